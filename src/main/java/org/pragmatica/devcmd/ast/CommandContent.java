package org.pragmatica.devcmd.ast;

import org.pragmatica.devcmd.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * What a command, block statement or pattern branch runs.
 */
public sealed interface CommandContent {
    SourceSpan span();

    /**
     * A single shell command line.
     */
    record ShellContent(List<ShellPart> parts, SourceSpan span) implements CommandContent {
        public ShellContent {
            parts = List.copyOf(parts);
        }

        /**
         * Concatenated text of the text parts, decorators rendered in source form.
         */
        public String text() {
            var sb = new StringBuilder();
            for (var part : parts) {
                if (part instanceof ShellPart.TextPart text) {
                    sb.append(text.text());
                } else if (part instanceof FunctionDecorator decorator) {
                    sb.append(decorator.text());
                }
            }
            return sb.toString();
        }

        public boolean isEmpty() {
            return parts.isEmpty();
        }
    }

    /**
     * Block decorators wrapping content. Decorators are listed outermost first, so
     * {@code @timeout(1m) @retry(3) { ... }} wraps the retried content in the timeout.
     */
    record DecoratedContent(List<Decorator> decorators, CommandContent content, SourceSpan span)
        implements CommandContent {
        public DecoratedContent {
            decorators = List.copyOf(decorators);
        }
    }

    /**
     * A pattern decorator such as {@code @when(ENV)} selecting one of its branches.
     */
    record PatternContent(Decorator decorator, List<PatternBranch> branches, SourceSpan span)
        implements CommandContent {
        public PatternContent {
            branches = List.copyOf(branches);
        }

        public Optional<PatternBranch> branch(String label) {
            return branches.stream()
                           .filter(branch -> branch.pattern().label().equals(label))
                           .findFirst();
        }
    }

    /**
     * Statements of a block, in order. Only produced for blocks with zero or several statements.
     */
    record BlockContent(List<CommandContent> contents, SourceSpan span) implements CommandContent {
        public BlockContent {
            contents = List.copyOf(contents);
        }
    }
}
