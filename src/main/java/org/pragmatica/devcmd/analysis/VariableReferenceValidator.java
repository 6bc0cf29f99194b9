package org.pragmatica.devcmd.analysis;

import org.pragmatica.devcmd.ast.AstQueries;
import org.pragmatica.devcmd.ast.Program;
import org.pragmatica.devcmd.ast.VariableDecl;
import org.pragmatica.devcmd.error.ErrorCollector;
import org.pragmatica.devcmd.error.ParseError;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cross-checks {@code @var(NAME)} references against the declared variables.
 */
public final class VariableReferenceValidator {
    private VariableReferenceValidator() {}

    public static void validate(Program program, ErrorCollector errors) {
        Set<String> declared = program.allVariables()
                                      .stream()
                                      .map(VariableDecl::name)
                                      .collect(Collectors.toSet());
        for (var reference : AstQueries.findVariableReferences(program)) {
            var name = AstQueries.referencedName(reference);
            if (name.isPresent() && !declared.contains(name.get())) {
                errors.add(ParseError.reference(reference.nameToken(),
                                                "undefined variable '" + name.get() + "'",
                                                "variable reference",
                                                "declare it with 'var " + name.get() + " = value'"));
            }
        }
    }
}
