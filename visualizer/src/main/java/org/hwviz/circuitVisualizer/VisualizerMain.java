package org.hwviz.circuitVisualizer;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.hwviz.circuitVisualizer.backend.ToDot;
import org.hwviz.circuitVisualizer.compiler.CircuitVisualizer;
import org.hwviz.circuitVisualizer.compiler.VisualizerOptions;
import org.hwviz.circuitVisualizer.errors.BaseVisualizerException;
import org.hwviz.circuitVisualizer.errors.CompilerMessages;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.graph.ModuleNode;
import org.hwviz.circuitVisualizer.ir.Circuit;
import org.hwviz.util.Logger;
import org.hwviz.util.Utilities;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Map;

/** Main entry point of the circuit visualizer. */
public class VisualizerMain {
    final VisualizerOptions options;

    VisualizerMain() {
        this.options = new VisualizerOptions();
    }

    void usage(JCommander commander) {
        commander.usage();
        System.out.println("<dotProgram> is one of the dot family: circo, dot, fdp, neato, osage, sfdp, twopi;");
        System.out.println("             default is dot, use none to not produce a png file");
        System.out.println("<openProgram> default is open, use none to not display the png file");
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("circuit-visualizer");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            this.usage(commander);
            return 1;
        }
        if (this.options.getInputFile() == null || this.options.mainParameters.size() > 3) {
            System.err.println("Expected arguments: <circuit.json> [dotProgram] [openProgram]");
            return 1;
        }

        for (Map.Entry<String, String> entry: this.options.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                System.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return 1;
            } catch (BaseVisualizerException ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }
        return 0;
    }

    /** Run the visualizer; the messages carry the exit code. */
    CompilerMessages run() {
        CircuitVisualizer visualizer = new CircuitVisualizer(this.options);
        String inputFile = this.options.getInputFile();
        assert inputFile != null;
        if (this.options.verbosity >= 1)
            System.out.println(this.options);

        File file;
        try {
            Circuit circuit = new CircuitJsonReader().read(Paths.get(inputFile));
            ModuleNode root = visualizer.translate(circuit);
            if (visualizer.hasErrors())
                return visualizer.messages;
            file = new ToDot(circuit.main, root).write(this.options.outputDirectory);
        } catch (IOException e) {
            visualizer.reportError("", "Error accessing file",
                    Utilities.singleQuote(inputFile) + " " + e.getMessage());
            return visualizer.messages;
        } catch (BaseVisualizerException e) {
            visualizer.messages.reportError(e);
            return visualizer.messages;
        }

        try {
            ToDot.show(file, visualizer.getDotProgram(), visualizer.getOpenProgram());
        } catch (IOException e) {
            // The dot file is complete; only the conversion or the display failed
            visualizer.reportError("", "Error running program", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            visualizer.messages.reportError(e);
        }
        return visualizer.messages;
    }

    public static CompilerMessages execute(String... argv) {
        VisualizerMain main = new VisualizerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            // return empty messages
            CompilerMessages result = new CompilerMessages();
            result.setExitCode(exitCode);
            return result;
        }
        return main.run();
    }

    public static void main(String[] argv) {
        CompilerMessages messages = execute(argv);
        messages.show(System.err);
        System.exit(messages.exitCode);
    }
}
