package com.rnfa.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.rnfa.nfa.Nfa;
import com.rnfa.nfa.TransitionKey;
import com.rnfa.nfa.TransitionLabel;
import com.rnfa.regex.ExpressionNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.tuple.Pair;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;

public class OutputFormatter {
    private final boolean json;
    private final boolean prettyPrint;

    private final JsonFactory factory = JsonFactory.builder()
            .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
            .build();

    public OutputFormatter() {
        this(false, true);
    }

    public OutputFormatter(boolean json, boolean prettyPrint) {
        this.json = json;
        this.prettyPrint = prettyPrint;
    }

    public String format(ExpressionNode tree) {
        if (json) {
            return writeJson(generator -> writeTree(tree, generator));
        }
        StringBuilder sb = new StringBuilder("Expression Tree:\n");
        formatTree(tree, 1, sb);
        return sb.toString();
    }

    public String format(Nfa nfa) {
        if (json) {
            return writeJson(generator -> writeNfa(nfa, generator));
        }

        StringBuilder sb = new StringBuilder(512);
        sb.append("Generated NFA:\n");
        sb.append("\tInitial State: (").append(nfa.initialState()).append(")\n");
        sb.append("\tFinal State: ((").append(nfa.finalState()).append("))\n");
        sb.append("\tStates(").append(nfa.states().size()).append("): ")
          .append(nfa.states().toSortedList()).append("\n");
        sb.append("\tAlphabet(").append(nfa.alphabet().size()).append("): ")
          .append(nfa.alphabet().toSortedList()).append("\n");
        sb.append("\tTransition Function(").append(nfa.transitionCount()).append("):");

        for (Pair<TransitionKey, ImmutableIntList> entry : sortedTransitions(nfa)) {
            sb.append("\n")
              .append(String.format("%20s", entry.getOne()))
              .append(" --> ")
              .append(entry.getTwo());
        }
        return sb.toString();
    }

    private record Line(ExpressionNode node, int indent) {}

    private void formatTree(ExpressionNode root, int indent, StringBuilder sb) {
        Deque<Line> pending = new ArrayDeque<>();
        pending.push(new Line(root, indent));

        while (!pending.isEmpty()) {
            Line line = pending.pop();
            sb.append("  ".repeat(line.indent()));
            if (line.node() instanceof ExpressionNode.Operand operand) {
                sb.append(operand.symbol()).append("\n");
            } else if (line.node() instanceof ExpressionNode.Unary unary) {
                sb.append(unary.operator()).append("\n");
                pending.push(new Line(unary.child(), line.indent() + 1));
            } else if (line.node() instanceof ExpressionNode.Binary binary) {
                sb.append(binary.operator()).append("\n");
                pending.push(new Line(binary.right(), line.indent() + 1));
                pending.push(new Line(binary.left(), line.indent() + 1));
            }
        }
    }

    private void writeTree(ExpressionNode root, JsonGenerator generator) throws IOException {
        Deque<JsonWriter> pending = new ArrayDeque<>();
        pending.push(g -> writeNode(root, g, pending));
        while (!pending.isEmpty()) {
            pending.pop().write(generator);
        }
    }

    // Writes the node's own fields and schedules its children, so deep trees need no recursion
    private void writeNode(ExpressionNode node, JsonGenerator generator, Deque<JsonWriter> pending)
            throws IOException {
        generator.writeStartObject();
        if (node instanceof ExpressionNode.Operand operand) {
            generator.writeStringField("type", "operand");
            generator.writeStringField("symbol", String.valueOf(operand.symbol().character()));
            generator.writeBooleanField("escaped", operand.symbol().escaped());
            generator.writeEndObject();
        } else if (node instanceof ExpressionNode.Unary unary) {
            generator.writeStringField("type", "star");
            pending.push(JsonGenerator::writeEndObject);
            pending.push(g -> writeNode(unary.child(), g, pending));
            pending.push(g -> g.writeFieldName("child"));
        } else if (node instanceof ExpressionNode.Binary binary) {
            generator.writeStringField("type", binary.operator().isAlternation() ? "alternation" : "concat");
            pending.push(JsonGenerator::writeEndObject);
            pending.push(g -> writeNode(binary.right(), g, pending));
            pending.push(g -> g.writeFieldName("right"));
            pending.push(g -> writeNode(binary.left(), g, pending));
            pending.push(g -> g.writeFieldName("left"));
        }
    }

    private void writeNfa(Nfa nfa, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeNumberField("initialState", nfa.initialState());
        generator.writeNumberField("finalState", nfa.finalState());

        generator.writeFieldName("states");
        generator.writeArray(nfa.states().toSortedArray(), 0, nfa.states().size());

        generator.writeArrayFieldStart("alphabet");
        for (Character character : nfa.alphabet().toSortedList()) {
            generator.writeString(String.valueOf(character));
        }
        generator.writeEndArray();

        generator.writeArrayFieldStart("transitions");
        for (Pair<TransitionKey, ImmutableIntList> entry : sortedTransitions(nfa)) {
            TransitionKey key = entry.getOne();
            generator.writeStartObject();
            generator.writeNumberField("from", key.state());
            if (key.label() instanceof TransitionLabel.Literal literal) {
                generator.writeStringField("label", String.valueOf(literal.character()));
            } else {
                generator.writeNullField("label");
            }
            generator.writeFieldName("to");
            generator.writeArray(entry.getTwo().toArray(), 0, entry.getTwo().size());
            generator.writeEndObject();
        }
        generator.writeEndArray();

        generator.writeEndObject();
    }

    private static MutableList<Pair<TransitionKey, ImmutableIntList>> sortedTransitions(Nfa nfa) {
        return nfa.transitions().keyValuesView().toSortedListBy(Pair::getOne);
    }

    private String writeJson(JsonWriter writer) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            writer.write(generator);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render JSON", e);
        }
        return out.toString();
    }

    @FunctionalInterface
    private interface JsonWriter {
        void write(JsonGenerator generator) throws IOException;
    }
}
