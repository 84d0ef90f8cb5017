package org.hwviz.circuitVisualizer.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.hwviz.util.Utilities;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Errors and warnings accumulated while visualizing a circuit. */
public class CompilerMessages implements IErrorReporter {
    public static class Message {
        /** Module instance where the message originated; may be empty. */
        public final String location;
        public final boolean warning;
        public final String errorType;
        public final String message;

        protected Message(String location, boolean warning, String errorType, String message) {
            this.location = location;
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        Message(BaseVisualizerException e) {
            this("", false, e.getErrorKind(), e.getMessage());
        }

        Message(Throwable e) {
            this("", false,
                    "This is a bug in the visualizer (please report it to the developers)",
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        public void format(StringBuilder output) {
            if (!this.location.isEmpty()) {
                output.append(this.location)
                        .append(": ");
            }
            if (this.warning)
                output.append("warning:");
            else
                output.append("error:");
            output.append(" ")
                    .append(this.errorType)
                    .append(": ")
                    .append(this.message)
                    .append(System.lineSeparator());
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            result.put("location", this.location);
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }
    }

    public final List<Message> messages;
    public int exitCode = 0;
    /** If true only errors are shown. */
    public boolean quiet = false;
    /** If true messages are printed as a JSON array. */
    public boolean emitJson = false;

    public CompilerMessages() {
        this.messages = new ArrayList<>();
    }

    public void clear() {
        this.messages.clear();
    }

    public void setExitCode(int exitCode) {
        this.exitCode = exitCode;
    }

    void reportError(Message message) {
        this.messages.add(message);
        if (!message.warning) {
            this.setExitCode(1);
        }
    }

    @Override
    public void reportProblem(String location, boolean warning, String errorType, String message) {
        this.reportError(new Message(location, warning, errorType, message));
    }

    public void reportError(BaseVisualizerException e) {
        this.reportError(new Message(e));
    }

    public void reportError(Throwable e) {
        this.reportError(new Message(e));
    }

    @Override
    public boolean hasErrors() {
        return this.errorCount() > 0;
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public Message getMessage(int index) {
        return this.messages.get(index);
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public void show(PrintStream stream) {
        if (this.errorCount() + (this.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (this.emitJson) {
            JsonNode node = this.toJson();
            builder.append(node.toPrettyString());
        } else {
            for (Message message: this.messages) {
                if (this.quiet && message.warning)
                    continue;
                message.format(builder);
            }
        }
        return builder.toString();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages) {
            if (this.quiet && message.warning)
                continue;
            result.add(message.toJson(mapper));
        }
        return result;
    }
}
