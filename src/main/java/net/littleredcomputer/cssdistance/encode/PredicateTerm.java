package net.littleredcomputer.cssdistance.encode;

import net.littleredcomputer.cssdistance.cnf.ClauseSet;
import net.littleredcomputer.cssdistance.cnf.VariableAllocator;

/**
 * One conjunct of the question "is there a logical operator of weight at most w?".
 * Variables 1..n name the qubits (in permuted column order); anything else a term needs it
 * takes from the allocator.
 */
interface PredicateTerm {
    String name();

    ClauseSet encode(VariableAllocator allocator);
}
