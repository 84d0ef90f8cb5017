package org.hwviz.circuitVisualizer.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import org.hwviz.circuitVisualizer.annotation.VisualizerAnnotation;
import org.hwviz.circuitVisualizer.errors.IErrorReporter;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Command-line options for the circuit visualizer. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class VisualizerOptions {
    @Parameter(description = "<circuit.json> [dotProgram] [openProgram]")
    public List<String> mainParameters = new ArrayList<>();
    @Parameter(names = "-o", description = "Directory where the dot file is written")
    public String outputDirectory = ".";
    @Parameter(names = "--dot", description = "Program that converts the dot file to png; 'none' to skip")
    @Nullable
    public String dotProgram = null;
    @Parameter(names = "--open", description = "Program that displays the png file; 'none' to skip")
    @Nullable
    public String openProgram = null;
    @Parameter(names = "--depth",
            description = "Number of module instance levels expanded below the top module")
    @Nullable
    public Integer depth = null;
    /** Ordered: the first directive that applies to a module wins. */
    @DynamicParameter(names = "--scope",
            description = "Depth for all instances of a module: Module=depth (can be repeated)")
    public Map<String, String> scopes = new LinkedHashMap<>();
    @Parameter(names = "--strict",
            description = "Report connections that cannot be drawn and missing modules as errors")
    public boolean strict = false;
    @Parameter(names = "-q", description = "Quiet: do not print warnings")
    public boolean quiet = false;
    @Parameter(names = "-v", description = "Output verbosity")
    public int verbosity = 0;
    @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array to the error output")
    public boolean emitJsonErrors = false;
    @DynamicParameter(names = "-T",
            description = "Specify logging level for a class (can be repeated)")
    public Map<String, String> loggingLevel = new HashMap<>();
    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;

    @Nullable
    public String getInputFile() {
        if (this.mainParameters.isEmpty())
            return null;
        return this.mainParameters.get(0);
    }

    /** Drawing program chosen on the command line, either as an option or as the second argument. */
    @Nullable
    public String getDotProgram() {
        if (this.dotProgram != null)
            return this.dotProgram;
        if (this.mainParameters.size() > 1)
            return this.mainParameters.get(1);
        return null;
    }

    /** Viewing program chosen on the command line, either as an option or as the third argument. */
    @Nullable
    public String getOpenProgram() {
        if (this.openProgram != null)
            return this.openProgram;
        if (this.mainParameters.size() > 2)
            return this.mainParameters.get(2);
        return null;
    }

    /** Depth annotations described by the options, in the order given; {@code --depth}
     * comes last and limits the expansion below the top module {@code main}. */
    public List<VisualizerAnnotation> getAnnotations(String main, IErrorReporter reporter) {
        List<VisualizerAnnotation> result = new ArrayList<>();
        for (Map.Entry<String, String> entry: this.scopes.entrySet()) {
            try {
                int depth = Integer.parseInt(entry.getValue().trim());
                result.add(VisualizerAnnotation.depth(entry.getKey(), depth));
            } catch (NumberFormatException ex) {
                reporter.reportError("", "Invalid option",
                        "--scope must be followed by 'module=number'; could not parse " + entry);
            }
        }
        if (this.depth != null)
            result.add(VisualizerAnnotation.depth(main, this.depth));
        return result;
    }

    @Override
    public String toString() {
        return "VisualizerOptions{" +
                "\n\tmainParameters=" + this.mainParameters +
                ",\n\toutputDirectory=" + this.outputDirectory +
                ",\n\tdotProgram=" + this.dotProgram +
                ",\n\topenProgram=" + this.openProgram +
                ",\n\tdepth=" + this.depth +
                ",\n\tscopes=" + this.scopes +
                ",\n\tstrict=" + this.strict +
                ",\n\tquiet=" + this.quiet +
                ",\n\tverbosity=" + this.verbosity +
                ",\n\temitJsonErrors=" + this.emitJsonErrors +
                '}';
    }
}
