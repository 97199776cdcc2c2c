package ember.client;

import ember.protocol.Frame;
import ember.protocol.ProtocolException;
import ember.utils.Log;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Interactive shell: reads a line, sends it as a command, prints the reply.
 * Usage: {@code EmberCli [-h host] [-p port]}
 */
public class EmberCli {

    public static void main(String[] args) throws IOException {
        String host = "127.0.0.1";
        int port = 6379;
        for (int i = 0; i < args.length; i++) {
            if ("-h".equals(args[i]) && i + 1 < args.length) {
                host = args[++i];
            } else if ("-p".equals(args[i]) && i + 1 < args.length) {
                port = Integer.parseInt(args[++i]);
            }
        }

        try (EmberClient client = EmberClient.connect(host, port)) {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            run(client, in, System.out, host + ":" + port + "> ");
        } catch (IOException e) {
            Log.error("Could not talk to " + host + ":" + port + ": " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(EmberClient client, BufferedReader in, PrintStream out, String prompt) throws IOException {
        while (true) {
            out.print(prompt);
            out.flush();
            String line = in.readLine();
            if (line == null) return;

            List<String> parts;
            try {
                parts = tokenize(line);
            } catch (IllegalArgumentException e) {
                out.println("(error) " + e.getMessage());
                continue;
            }
            if (parts.isEmpty()) continue;

            String name = parts.get(0);
            if (name.equalsIgnoreCase("exit")) return;

            try {
                Frame reply = client.command(parts.toArray(new String[0]));
                out.println(ReplyFormatter.format(reply));
            } catch (EOFException e) {
                if (!name.equalsIgnoreCase("quit")) out.println("Connection closed by server");
                return;
            } catch (ProtocolException e) {
                // The reply stream can no longer be trusted.
                out.println("(error) " + e.getMessage());
                return;
            }
            if (name.equalsIgnoreCase("quit")) return;
        }
    }

    /** Splits on whitespace; double quotes group words and allow \" \\ \n \r \t escapes. */
    static List<String> tokenize(String line) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean inToken = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '\\' && i + 1 < line.length()) {
                    char next = line.charAt(++i);
                    switch (next) {
                        case 'n': current.append('\n'); break;
                        case 'r': current.append('\r'); break;
                        case 't': current.append('\t'); break;
                        default: current.append(next);
                    }
                } else if (c == '"') {
                    inQuotes = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    parts.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inQuotes) {
            throw new IllegalArgumentException("unbalanced quotes");
        }
        if (inToken) parts.add(current.toString());
        return parts;
    }
}
