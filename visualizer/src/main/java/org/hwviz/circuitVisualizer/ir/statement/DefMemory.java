package org.hwviz.circuitVisualizer.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

import java.util.List;

/** A memory with named reader, writer and read-writer ports. */
public final class DefMemory extends Statement {
    public final String name;
    public final long depth;
    public final List<String> readers;
    public final List<String> writers;
    public final List<String> readwriters;

    public DefMemory(String name, long depth, List<String> readers,
                     List<String> writers, List<String> readwriters) {
        this.name = name;
        this.depth = depth;
        this.readers = readers;
        this.writers = writers;
        this.readwriters = readwriters;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("mem ")
                .append(this.name)
                .append(" :")
                .increase()
                .append("depth => ")
                .append(this.depth);
        for (String reader: this.readers)
            builder.newline().append("reader => ").append(reader);
        for (String writer: this.writers)
            builder.newline().append("writer => ").append(writer);
        for (String readwriter: this.readwriters)
            builder.newline().append("readwriter => ").append(readwriter);
        return builder.decrease();
    }

    @SuppressWarnings("unused")
    public static DefMemory fromJson(JsonNode node, CircuitJsonReader reader) {
        String name = Utilities.getStringProperty(node, "name");
        long depth = Utilities.getProperty(node, "depth").asLong();
        List<String> readers = Utilities.getStringListProperty(node, "readers");
        List<String> writers = Utilities.getStringListProperty(node, "writers");
        List<String> readwriters = Utilities.getStringListProperty(node, "readwriters");
        return new DefMemory(name, depth, readers, writers, readwriters);
    }
}
