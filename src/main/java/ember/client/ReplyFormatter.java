package ember.client;

import ember.protocol.Frame;

import java.util.List;

/**
 * Renders replies the way redis-cli prints them.
 */
public final class ReplyFormatter {

    private ReplyFormatter() {
    }

    public static String format(Frame reply) {
        return format(reply, 0).trim();
    }

    private static String format(Frame reply, int level) {
        switch (reply.type()) {
            case SIMPLE:
                return reply.text();
            case ERROR:
                return "(error) " + reply.text();
            case INTEGER:
                return "(integer) " + reply.integer();
            case BULK:
                return reply.isNull() ? "(nil)" : "\"" + reply.bulkString() + "\"";
            case ARRAY:
                if (reply.isNull()) return "(nil)";
                return formatArray(reply.elements(), level);
            default:
                throw new IllegalStateException("unknown frame type " + reply.type());
        }
    }

    private static String formatArray(List<Frame> elements, int level) {
        if (elements.isEmpty()) return "(empty array)";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            Frame element = elements.get(i);
            if (i > 0) {
                for (int j = 0; j < level; j++) sb.append("   ");
            }
            sb.append(i + 1).append(") ");
            if (element.type() == Frame.Type.ARRAY && !element.isNull() && !element.elements().isEmpty()) {
                sb.append(format(element, level + 1));
            } else {
                sb.append(format(element, level + 1)).append("\n");
            }
        }
        return sb.toString();
    }
}
