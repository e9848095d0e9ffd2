/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.qirt.state;

import io.github.qirt.annotations.VisibleForTesting;
import io.github.qirt.exceptions.DimensionMismatchException;
import io.github.qirt.exceptions.ZeroStateException;
import io.github.qirt.notation.Basis;
import io.github.qirt.notation.BasisBit;
import io.github.qirt.notation.BasisTable;
import io.github.qirt.util.QubitLimits;
import io.github.qirt.vector.ComplexVector;
import io.github.qirt.vector.ComplexVectorUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static io.github.qirt.util.MathUtil.INV_SQRT2;

/**
 * Turns symbolic labels into a normalized amplitude vector.
 * <p>
 * Each character of a label is resolved through the {@link BasisTable} to a (basis, bit)
 * pair, so one label may mix Z, X and Y symbols. The label's vector is the tensor product of
 * the per-qubit eigenvectors, qubit 0 in the least significant index bit, times its
 * coefficient. The sum over all labels is divided by its norm.
 */
public class LabelParser {
    private static final Logger logger = LoggerFactory.getLogger(LabelParser.class);

    private final BasisTable table;

    /**
     * Creates a parser over the process-wide table as installed right now.
     */
    public LabelParser() {
        this(BasisTable.getInstance());
    }

    public LabelParser(BasisTable table) {
        this.table = Objects.requireNonNull(table);
    }

    public BasisTable getTable() {
        return table;
    }

    /**
     * Parses labels with coefficient 1.
     */
    public ComplexVector parse(String... labels) {
        return parse(Arrays.stream(labels).map(Label::of).toArray(Label[]::new));
    }

    public ComplexVector parse(Label... labels) {
        return parse(Arrays.asList(labels));
    }

    /**
     * @param labels the terms to sum; all must have the same length
     * @return the normalized sum, of length 2^n for labels of length n
     * @throws DimensionMismatchException if there are no labels or their lengths differ
     * @throws io.github.qirt.exceptions.UnknownSymbolException if a character is not registered
     * @throws ZeroStateException if the terms cancel
     * @throws io.github.qirt.exceptions.CapacityExceededException if n is above the qubit ceiling
     */
    public ComplexVector parse(List<Label> labels) {
        if (labels.isEmpty()) {
            throw new DimensionMismatchException("At least one label is required");
        }
        int n = labels.get(0).length();
        for (Label label : labels) {
            if (label.length() != n) {
                throw new DimensionMismatchException(String.format("Every label must have the same number of qubits: '%s' has %d, '%s' has %d",
                                                                   labels.get(0).symbols, n, label.symbols, label.length()));
            }
        }
        QubitLimits.checkQubitCount(n);

        var sum = ComplexVector.create(1 << n);
        for (Label label : labels) {
            var term = productState(label.symbols);
            ComplexVectorUtil.scale(term, label.coefficient);
            ComplexVectorUtil.addInPlace(sum, term);
        }

        double norm = ComplexVectorUtil.norm(sum);
        if (norm <= QuantumState.EPSILON) {
            throw new ZeroStateException("Labels " + labels + " sum to the zero vector");
        }
        ComplexVectorUtil.scale(sum, 1 / norm);
        logger.debug("Parsed {} label(s) over {} qubit(s)", labels.size(), n);
        return sum;
    }

    /**
     * Returns the normalized product state named by a single string of symbols.
     *
     * @param symbols one ket symbol per qubit, qubit 0 first
     * @return the tensor product of the per-qubit eigenvectors
     */
    public ComplexVector productState(String symbols) {
        var result = ComplexVector.ofReal(1);
        for (int k = 0; k < symbols.length(); k++) {
            BasisBit bb = table.basisAndBitFor(symbols.charAt(k));
            // qubit k goes outside everything built so far
            result = ComplexVectorUtil.kron(eigenvector(bb.basis, bb.bit), result);
        }
        return result;
    }

    /**
     * The normalized single-qubit eigenvector: Z gives {1,0}/{0,1}, X gives {1,1}/{1,-1} and
     * Y gives {1,i}/{1,-i}, the latter two scaled by 1/sqrt(2).
     */
    @VisibleForTesting
    static ComplexVector eigenvector(Basis basis, int bit) {
        var v = ComplexVector.create(2);
        switch (basis) {
            case Z:
                v.set(bit, 1, 0);
                break;
            case X:
                v.set(0, INV_SQRT2, 0);
                v.set(1, bit == 0 ? INV_SQRT2 : -INV_SQRT2, 0);
                break;
            case Y:
                v.set(0, INV_SQRT2, 0);
                v.set(1, 0, bit == 0 ? INV_SQRT2 : -INV_SQRT2);
                break;
            default:
                throw new AssertionError(basis);
        }
        return v;
    }
}
