package org.pragmatica.plc.model;

import org.pragmatica.plc.ast.PouDeclaration;

import java.util.List;

/**
 * Siemens SCL. Organization blocks become programs. A global data block contributes its variables as
 * configuration globals; an instance data block becomes one global of its function block type.
 */
public final class SclToModel extends AstToModel {

    @Override
    protected String sourceFormat() {
        return "SCL";
    }

    @Override
    protected boolean convertDialect(PouDeclaration declaration, SourceFile source, ModelParts parts) {
        if (declaration instanceof PouDeclaration.OrganizationBlock block) {
            parts.addPou(pou(block, PouKind.PROGRAM, source));
            return true;
        }
        if (declaration instanceof PouDeclaration.DataBlock block) {
            if (block.instanceOf().isPresent()) {
                parts.addGlobals(List.of(Variable.of(block.name(), block.instanceOf().get(), VarClass.GLOBAL)));
            } else {
                block.varBlocks().forEach(varBlock -> parts.addGlobals(
                    variables(varBlock).stream()
                                       .map(variable -> variable.withVarClass(VarClass.GLOBAL))
                                       .toList()));
            }
            return true;
        }
        return false;
    }
}
