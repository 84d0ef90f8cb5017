package org.hwviz.circuitVisualizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.hwviz.circuitVisualizer.compiler.CircuitVisualizer;
import org.hwviz.circuitVisualizer.errors.CompilerMessages;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReaderTest;
import org.hwviz.util.Logger;
import org.hwviz.util.Utilities;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

public class VisualizerMainTest {
    Path outputDirectory;

    @Before
    public void createOutputDirectory() throws IOException {
        this.outputDirectory = Files.createTempDirectory("visualizer");
        this.outputDirectory.toFile().deleteOnExit();
    }

    String input(String name) throws URISyntaxException {
        return CircuitJsonReaderTest.resource(name).toString();
    }

    String output(String main) throws IOException {
        File file = this.outputDirectory.resolve(main + ".dot").toFile();
        Assert.assertTrue(file.exists());
        file.deleteOnExit();
        return Files.readString(file.toPath());
    }

    @Test
    public void adderTest() throws IOException, URISyntaxException {
        CompilerMessages messages = VisualizerMain.execute(
                "-o", this.outputDirectory.toString(), "--dot", "none", this.input("adder.json"));
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertTrue(messages.isEmpty());
        Assert.assertEquals("""
                digraph Top {
                    subgraph cluster_Top {
                        label="Top"
                        Top_a [ shape=box label="a" ]
                        Top_b [ shape=box label="b" ]
                        Top_c [ shape=box label="c" ]
                        "Top_op_add#0" [ shape=record label="{{<in1> in1|<in2> in2}|add|<out> out}" ]
                        Top_a -> "Top_op_add#0":in1;
                        Top_b -> "Top_op_add#0":in2;
                        "Top_op_add#0":out -> Top_c;
                    }
                }
                """, this.output("Top"));
    }

    @Test
    public void hierarchyTest() throws IOException, URISyntaxException {
        // The circuit itself disables the conversion to png
        CompilerMessages messages = VisualizerMain.execute(
                "-o", this.outputDirectory.toString(), this.input("hierarchy.json"));
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertEquals("""
                digraph Top {
                    subgraph cluster_Top {
                        label="Top"
                        Top_clk [ shape=box label="clk" ]
                        Top_i [ shape=box label="i" ]
                        Top_o [ shape=box label="o" ]
                        subgraph cluster_Top_c {
                            label="c"
                            Top_c_x [ shape=box label="x" ]
                            Top_c_y [ shape=box label="y" ]
                        }
                        subgraph cluster_Top_x {
                            label="x"
                            Top_x_q [ shape=box label="q" ]
                        }
                        Top_r [ shape=record label="{<in> next|r}" ]
                        Top_mem [ shape=none margin=0 label=<
                            <TABLE BORDER="0" CELLBORDER="1" CELLSPACING="0">
                                <TR><TD><B>mem</B></TD><TD>depth 16</TD></TR>
                                <TR><TD>rd</TD><TD PORT="rd_en">en</TD><TD PORT="rd_addr">addr</TD><TD PORT="rd_data">data</TD><TD PORT="rd_clk">clk</TD></TR>
                                <TR><TD>wr</TD><TD PORT="wr_en">en</TD><TD PORT="wr_addr">addr</TD><TD PORT="wr_data">data</TD><TD PORT="wr_mask">mask</TD><TD PORT="wr_clk">clk</TD></TR>
                            </TABLE>
                        > ]
                        "Top_mux#0" [ shape=record label="{{<select> select|<in1> in1|<in2> in2}|mux|<out> out}" ]
                        "Top_lit#0" [ shape=circle label="255" ]
                        "Top_lit#1" [ shape=circle label="-1" ]
                        "Top_op_bits#1" [ shape=record label="{{<in1> in1}|bits(7,\\ 4)|<out> out}" ]
                        Top_n [ shape=ellipse label="n" ]
                        "Top_validif#2" [ shape=record label="{{<select> select|<in1> in1}|validif|<out> out}" ]
                        Top_w [ shape=ellipse label="w" ]
                        Top_i -> "Top_mux#0":select;
                        "Top_lit#0" -> "Top_mux#0":in1;
                        "Top_lit#1" -> "Top_mux#0":in2;
                        "Top_mux#0":out -> Top_c_x;
                        Top_c_y -> "Top_op_bits#1":in1;
                        "Top_op_bits#1":out -> Top_r:in;
                        Top_i -> "Top_validif#2":select;
                        Top_r -> "Top_validif#2":in1;
                        "Top_validif#2":out -> Top_n;
                        Top_x_q_2_ -> Top_o;
                    }
                }
                """, this.output("Top"));
    }

    @Test
    public void positionalProgramsTest() throws IOException, URISyntaxException {
        CompilerMessages messages = VisualizerMain.execute(
                "-o", this.outputDirectory.toString(), "--depth", "0", this.input("adder.json"), "none", "none");
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertTrue(this.output("Top").startsWith("digraph Top {"));
    }

    /** True when Graphviz dot can be executed. */
    static boolean isDotInstalled() {
        try {
            Utilities.runProcess(".", "dot", "-V");
            return true;
        } catch (IOException ex) {
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Test
    public void pngTest() throws IOException, URISyntaxException {
        if (!isDotInstalled())
            return;
        CompilerMessages messages = VisualizerMain.execute(
                "-o", this.outputDirectory.toString(), this.input("adder.json"), "dot", "none");
        Assert.assertEquals(0, messages.exitCode);
        this.output("Top");
        File png = this.outputDirectory.resolve("Top.dot.png").toFile();
        Assert.assertTrue(png.exists());
        png.deleteOnExit();
    }

    @Test
    public void failingProgramTest() throws IOException, URISyntaxException {
        String input = this.input("adder.json");
        CompilerMessages messages = VisualizerMain.execute(
                "-o", this.outputDirectory.toString(), "--dot", "no-such-dot-program", input);
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
        CompilerMessages.Message error = messages.getMessage(0);
        Assert.assertEquals("Error running program", error.errorType);
        Assert.assertTrue(error.message.contains("no-such-dot-program"));
        Assert.assertFalse(error.message.contains("adder.json"));
        // The dot file was written before the conversion failed
        this.output("Top");
    }

    @Test
    public void missingArgumentTest() {
        CompilerMessages messages = VisualizerMain.execute();
        Assert.assertEquals(1, messages.exitCode);
        messages = VisualizerMain.execute("--no-such-option", "circuit.json");
        Assert.assertEquals(1, messages.exitCode);
        messages = VisualizerMain.execute("a.json", "dot", "open", "extra");
        Assert.assertEquals(1, messages.exitCode);
    }

    @Test
    public void missingFileTest() {
        String missing = this.outputDirectory.resolve("missing.json").toString();
        CompilerMessages messages = VisualizerMain.execute("--dot", "none", missing);
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.errorCount());
        Assert.assertEquals("Error accessing file", messages.getMessage(0).errorType);
    }

    @Test
    public void strictTest() throws IOException, URISyntaxException {
        Path input = this.outputDirectory.resolve("bad.json");
        Files.writeString(input, """
                { "class": "Circuit", "main": "Top", "modules": [ {
                    "class": "CircuitModule", "name": "Top", "ports": [],
                    "body": { "class": "DefInstance", "name": "u", "module": "Unknown" } } ] }
                """);
        input.toFile().deleteOnExit();
        CompilerMessages messages = VisualizerMain.execute(
                "-o", this.outputDirectory.toString(), "--dot", "none", input.toString());
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertEquals(1, messages.warningCount());
        this.output("Top");

        messages = VisualizerMain.execute(
                "-o", this.outputDirectory.toString(), "--strict", "--je", "--dot", "none", input.toString());
        Assert.assertEquals(1, messages.exitCode);
        JsonNode json = new ObjectMapper().readTree(messages.toString());
        Assert.assertTrue(json.isArray());
        Assert.assertEquals("Compilation error", json.get(0).get("error_type").asText());
    }

    @Test
    public void unsupportedElementsTest() throws IOException {
        Path input = this.outputDirectory.resolve("unsupported.json");
        Files.writeString(input, """
                { "class": "Circuit", "main": "Top", "modules": [ {
                    "class": "CircuitModule", "name": "Top",
                    "ports": [ { "class": "Port", "name": "i", "direction": "input" },
                               { "class": "Port", "name": "o", "direction": "output" },
                               { "class": "Port", "name": "p", "direction": "output" } ],
                    "body": { "class": "Block", "stmts": [
                        { "class": "Stop", "ret": 1 },
                        { "class": "Connect",
                          "loc": { "class": "Reference", "name": "o" },
                          "expr": { "class": "DoPrim", "op": "squz",
                                    "args": [ { "class": "Reference", "name": "i" } ] } },
                        { "class": "Connect",
                          "loc": { "class": "Reference", "name": "p" },
                          "expr": { "class": "FixedLiteral", "value": 3 } } ] } } ] }
                """);
        input.toFile().deleteOnExit();
        CompilerMessages messages = VisualizerMain.execute(
                "-o", this.outputDirectory.toString(), "--dot", "none", input.toString());
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertTrue(messages.isEmpty());
        String dot = this.output("Top");
        Assert.assertTrue(dot.contains("dummy -> Top_o;"));
        Assert.assertTrue(dot.contains("\"\" -> Top_p;"));
    }

    @Test
    public void missingTopModuleTest() throws IOException {
        Path input = this.outputDirectory.resolve("notop.json");
        Files.writeString(input, """
                { "class": "Circuit", "main": "Top", "modules": [] }
                """);
        input.toFile().deleteOnExit();
        CompilerMessages messages = VisualizerMain.execute("--dot", "none", input.toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("Could not find top level module in Top"));
    }

    @Test
    public void loggingParameterTest() throws URISyntaxException {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        CompilerMessages messages = VisualizerMain.execute("-TCircuitVisualizer=1", "-TToDot=1",
                "-o", this.outputDirectory.toString(), "--dot", "none", this.input("adder.json"));
        Logger.INSTANCE.setLoggingLevel(CircuitVisualizer.class, 0);
        Logger.INSTANCE.setLoggingLevel("ToDot", 0);
        Logger.INSTANCE.setDebugStream(save);
        Assert.assertEquals(0, messages.exitCode);
        String log = builder.toString();
        Assert.assertTrue(log.contains("Declared 3 names"));
        Assert.assertTrue(log.contains("Wrote "));

        messages = VisualizerMain.execute("-TNoSuchClass=1", this.input("adder.json"));
        Assert.assertEquals(1, messages.exitCode);
    }
}
