package org.stlint.analyzer.common.model;

// JMP label;
public record JumpStatement(String label, SourceMeta meta) implements Statement {

    @Override
    public Shape<?> shape() {
        return Shape.JUMP;
    }
}
