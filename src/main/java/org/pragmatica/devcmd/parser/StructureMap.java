package org.pragmatica.devcmd.parser;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of the structural pass: where every variable, command, decorator and block sits in the
 * token sequence. All ranges are closed intervals of token indices.
 */
public record StructureMap(List<VariableSpan> variables,
                           List<CommandSpan> commands,
                           List<DecoratorSpan> decorators,
                           List<BlockRange> blocks) {

    public static final StructureMap EMPTY = new StructureMap(List.of(), List.of(), List.of(), List.of());

    public StructureMap {
        variables = List.copyOf(variables);
        commands = List.copyOf(commands);
        decorators = List.copyOf(decorators);
        blocks = List.copyOf(blocks);
    }

    /**
     * Closed interval {@code [start, end]}; {@code start > end} means empty.
     */
    public record TokenRange(int start, int end) {
        public static TokenRange empty(int at) {
            return new TokenRange(at, at - 1);
        }

        public boolean isEmpty() {
            return start > end;
        }

        public int size() {
            return isEmpty() ? 0 : end - start + 1;
        }

        public boolean contains(int index) {
            return index >= start && index <= end;
        }
    }

    /**
     * @param group range of the enclosing {@code var ( ... )}, parentheses included, when grouped
     */
    public record VariableSpan(int nameIndex, TokenRange value, boolean grouped, Optional<TokenRange> group) {}

    /**
     * @param typeIndex  index of the {@code watch}/{@code stop} keyword, or -1 for a plain command
     * @param body       body tokens; braces included for explicit blocks
     * @param decorators indices into {@link StructureMap#decorators()} of decorators leading a
     *                   simple body
     */
    public record CommandSpan(int typeIndex, int nameIndex, int colonIndex, TokenRange body, boolean block,
                              List<Integer> decorators) {
        public CommandSpan {
            decorators = List.copyOf(decorators);
        }

        public boolean hasType() {
            return typeIndex >= 0;
        }
    }

    /**
     * @param args  tokens between the parentheses, when present
     * @param block block tokens, braces included, when present
     */
    public record DecoratorSpan(int atIndex, int nameIndex, Optional<TokenRange> args, Optional<TokenRange> block,
                                List<ArgumentSpan> arguments) {
        public DecoratorSpan {
            arguments = List.copyOf(arguments);
        }

        /**
         * Index of the last token belonging to this decorator.
         */
        public int end() {
            return block.map(TokenRange::end)
                        .orElseGet(() -> args.map(range -> range.end() + 1).orElse(nameIndex));
        }

        /**
         * Index of the last token before the block, i.e. the closing parenthesis or the name.
         */
        public int headEnd() {
            return args.map(range -> range.end() + 1).orElse(nameIndex);
        }
    }

    public record ArgumentSpan(Optional<String> name, TokenRange value) {}

    /**
     * @param range statements area between the braces
     */
    public record BlockRange(int openIndex, int closeIndex, TokenRange range, List<StatementSpan> statements) {
        public BlockRange {
            statements = List.copyOf(statements);
        }
    }

    /**
     * @param decoratorIndex index into {@link StructureMap#decorators()} of the decorator the
     *                       statement starts with, or -1
     */
    public record StatementSpan(TokenRange range, int decoratorIndex) {
        public boolean startsWithDecorator() {
            return decoratorIndex >= 0;
        }
    }

    public Map<Integer, DecoratorSpan> decoratorsByAt() {
        var index = new HashMap<Integer, DecoratorSpan>();
        decorators.forEach(span -> index.put(span.atIndex(), span));
        return index;
    }

    public Map<Integer, BlockRange> blocksByOpen() {
        var index = new HashMap<Integer, BlockRange>();
        blocks.forEach(block -> index.put(block.openIndex(), block));
        return index;
    }

    public Optional<DecoratorSpan> decoratorAt(int atIndex) {
        return decorators.stream().filter(span -> span.atIndex() == atIndex).findFirst();
    }
}
