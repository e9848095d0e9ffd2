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

package io.github.qirt.example;

import io.github.qirt.exceptions.QirtException;
import io.github.qirt.notation.BasisTable;
import io.github.qirt.notation.NotationConfig;
import io.github.qirt.state.BasisAssignment;
import io.github.qirt.state.BasisOptimizer;
import io.github.qirt.state.BasisPattern;
import io.github.qirt.state.Label;
import io.github.qirt.state.LabelParser;
import io.github.qirt.state.MeasurementEngine;
import io.github.qirt.state.MeasurementOutcome;
import io.github.qirt.state.MeasurementOutcomeSet;
import io.github.qirt.state.QuantumState;
import io.github.qirt.state.StateTerm;
import org.apache.commons.math3.random.Well19937c;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command-line interface for building, displaying, measuring and sampling states.
 *
 * <h2>Available Subcommands</h2>
 * <ul>
 *   <li>{@code state} - print a state's terms in a basis</li>
 *   <li>{@code measure} - print every outcome of measuring some qubits</li>
 *   <li>{@code sample} - print observed counts for repeated measurement</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 * <pre>
 * # Bell state in the X basis
 * qirt state 00 11 --basis xx
 *
 * # measure qubit 0 of a Bell state, letting qubit 1's display basis be chosen automatically
 * qirt measure 00 11 --qubits 0 --basis 'z*' --auto local
 *
 * # 1000 shots with a fixed seed, labels with coefficients
 * qirt sample 0.5:0 -0.5i:1 --qubits 0 --basis y --shots 1000 --seed 42
 * </pre>
 */
@CommandLine.Command(
        name = "qirt",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Build quantum states from ket labels, change basis and measure",
        subcommands = {
                QirtCLI.StateCommand.class,
                QirtCLI.MeasureCommand.class,
                QirtCLI.SampleCommand.class
        }
)
public class QirtCLI implements Callable<Integer> {

    /**
     * Called when no subcommand is specified. Displays help information.
     *
     * @return exit code 0
     */
    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new QirtCLI())
                .setCaseInsensitiveEnumValuesAllowed(true)
                // labels such as -1:10 or -+ start with a dash
                .setUnmatchedOptionsArePositionalParams(true)
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    if (e instanceof QirtException || e instanceof IllegalArgumentException) {
                        commandLine.getErr().println("error: " + e.getMessage());
                        return 2;
                    }
                    throw e;
                });
    }

    /**
     * Options shared by every subcommand: the labels and the notation file.
     */
    static class StateOptions {
        @CommandLine.Parameters(arity = "1..*", description = "Labels, written 'symbols' or 'coefficient:symbols', e.g. 01, -1:10, 0.5i:+-")
        List<String> labels;

        @CommandLine.Option(names = {"-n", "--notation"}, description = "YAML notation file with a 'ket' section")
        Path notation;

        LabelParser parser() {
            BasisTable table = notation == null ? BasisTable.getInstance() : NotationConfig.installFrom(notation);
            return new LabelParser(table);
        }

        QuantumState state(LabelParser parser) {
            var parsed = labels.stream().map(Label::parse).collect(Collectors.toList());
            return QuantumState.fromLabels(parser, parsed);
        }
    }

    /**
     * Prints the terms of a state in a given basis.
     */
    @CommandLine.Command(name = "state", description = "Print a state's terms, most probable first")
    static class StateCommand implements Callable<Integer> {
        @CommandLine.Mixin
        StateOptions options = new StateOptions();

        @CommandLine.Option(names = {"-b", "--basis"}, description = "Display basis per qubit (z, x, y, or * for automatic); missing entries are automatic")
        String basis = "";

        @CommandLine.Option(names = "--auto", description = "Automatic basis search: ${COMPLETION-CANDIDATES}", defaultValue = "GLOBAL")
        BasisOptimizer.Algorithm algorithm;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            var parser = options.parser();
            var state = options.state(parser);
            var assignment = resolve(state, basis, algorithm);
            PrintWriter out = spec.commandLine().getOut();
            out.printf(Locale.ROOT, "%d qubit(s), basis %s, entropy %.4f%n", state.qubitCount(), assignment, state.entropy(assignment));
            for (StateTerm term : state.terms(assignment, parser.getTable())) {
                out.printf(Locale.ROOT, "  %-24s p=%.6f%n", term, term.probability);
            }
            out.flush();
            return 0;
        }
    }

    /**
     * Prints every outcome of a measurement with its post-measurement state.
     */
    @CommandLine.Command(name = "measure", description = "Measure qubits and print every outcome")
    static class MeasureCommand implements Callable<Integer> {
        @CommandLine.Mixin
        StateOptions options = new StateOptions();

        @CommandLine.Option(names = {"-q", "--qubits"}, split = ",", required = true, description = "Qubits to measure, first is most significant")
        int[] qubits;

        @CommandLine.Option(names = {"-b", "--basis"}, description = "Basis per qubit (z, x, y, or * for automatic); missing entries are automatic")
        String basis = "";

        @CommandLine.Option(names = "--auto", description = "Automatic basis search: ${COMPLETION-CANDIDATES}", defaultValue = "GLOBAL")
        BasisOptimizer.Algorithm algorithm;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            var parser = options.parser();
            var state = options.state(parser);
            var assignment = resolve(state, basis, algorithm);
            MeasurementOutcomeSet outcomes = new MeasurementEngine(parser.getTable()).measure(state, qubits, assignment);
            PrintWriter out = spec.commandLine().getOut();
            out.printf(Locale.ROOT, "Measuring qubits %s in basis %s%n", Arrays.toString(qubits), assignment);
            for (MeasurementOutcome outcome : outcomes) {
                if (!outcome.isPossible()) {
                    out.printf(Locale.ROOT, "  |%s>  p=0%n", outcome.symbols);
                    continue;
                }
                var post = outcome.getPostMeasurementState();
                out.printf(Locale.ROOT, "  |%s>  p=%.6f  ->  %s%n", outcome.symbols, outcome.probability,
                           post.qubitCount() == 0 ? "(no qubits left)" : termsOf(post, outcome.remainingBasis, parser.getTable()));
            }
            out.flush();
            return 0;
        }
    }

    /**
     * Prints observed counts of repeated measurement.
     */
    @CommandLine.Command(name = "sample", description = "Sample measurement outcomes")
    static class SampleCommand implements Callable<Integer> {
        @CommandLine.Mixin
        StateOptions options = new StateOptions();

        @CommandLine.Option(names = {"-q", "--qubits"}, split = ",", required = true, description = "Qubits to measure, first is most significant")
        int[] qubits;

        @CommandLine.Option(names = {"-b", "--basis"}, description = "Basis per qubit (z, x, y, or * for automatic); missing entries are automatic")
        String basis = "";

        @CommandLine.Option(names = {"-s", "--shots"}, defaultValue = "1000", description = "Number of shots (default: ${DEFAULT-VALUE})")
        int shots;

        @CommandLine.Option(names = "--seed", description = "Seed for reproducible counts")
        Long seed;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @Override
        public Integer call() {
            var parser = options.parser();
            var state = options.state(parser);
            var assignment = resolve(state, basis, BasisOptimizer.Algorithm.GLOBAL);
            var random = seed == null ? new Well19937c() : new Well19937c(seed);
            Map<String, Integer> counts = new MeasurementEngine(parser.getTable()).sample(state, qubits, assignment, shots, random);
            PrintWriter out = spec.commandLine().getOut();
            counts.forEach((bits, count) -> out.printf(Locale.ROOT, "  %s  %d%n", bits, count));
            out.flush();
            return 0;
        }
    }

    /**
     * Open entries of the pattern, and qubits past its end, are chosen by minimum entropy, so an
     * omitted basis is fully automatic.
     */
    static BasisAssignment resolve(QuantumState state, String basis, BasisOptimizer.Algorithm algorithm) {
        var pattern = basis.isEmpty() ? BasisPattern.open(state.qubitCount()) : BasisPattern.parse(basis);
        return BasisOptimizer.resolve(state, pattern, algorithm);
    }

    private static String termsOf(QuantumState state, BasisAssignment basis, BasisTable table) {
        return state.terms(basis, table).stream().map(StateTerm::toString).collect(Collectors.joining(" + "));
    }
}
