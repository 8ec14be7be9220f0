package net.littleredcomputer.cssdistance;

import net.littleredcomputer.cssdistance.encode.CompiledQuery;
import net.littleredcomputer.cssdistance.gf2.BinaryMatrix;
import net.littleredcomputer.cssdistance.gf2.RowReducer;

/**
 * Turns a model of a compiled query back into an operator on the original qubits, and checks
 * it against the original matrices without reference to the clauses. A model that fails is
 * evidence of a broken encoding, never an answer.
 */
public final class WitnessDecoder {
    private WitnessDecoder() {}

    public static LogicalOperator decode(boolean[] model, CompiledQuery query,
                                         BinaryMatrix nullSpaceChecks, BinaryMatrix rowSpaceChecks) {
        if (model.length != query.cnf().nVariables()) {
            throw new EncodingDefectException(String.format("model assigns %d variables, instance has %d",
                    model.length, query.cnf().nVariables()));
        }
        if (!query.cnf().evaluate(model)) throw new EncodingDefectException("model does not satisfy the instance");
        boolean[] x = query.operator(model);
        LogicalOperator op = new LogicalOperator(x);
        if (op.weight() == 0) throw new EncodingDefectException("witness is the identity");
        if (op.weight() > query.bound()) {
            throw new EncodingDefectException(String.format("witness has weight %d, above the bound %d", op.weight(), query.bound()));
        }
        boolean[] syndrome = nullSpaceChecks.times(x);
        for (int i = 0; i < syndrome.length; ++i) {
            if (syndrome[i]) throw new EncodingDefectException("witness " + op + " violates check " + i);
        }
        if (RowReducer.inRowSpace(rowSpaceChecks, x)) {
            throw new EncodingDefectException("witness " + op + " is a stabilizer, not a logical operator");
        }
        return op;
    }
}
