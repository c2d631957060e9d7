package snek.lang;

import static lombok.AccessLevel.PRIVATE;
import static snek.lang.Token.Type.COLON;
import static snek.lang.Token.Type.UNKNOWN;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import lombok.RequiredArgsConstructor;

/**
 * Command line front end: parses a script, or lines typed at a prompt, and
 * prints what the lexer and parser made of it.
 */
@RequiredArgsConstructor(access = PRIVATE)
public class Snek {
    public static void main(String[] args) throws IOException {
        int exitCode;
        if (args.length > 1) {
            System.out.println("Usage: snek [script]");
            exitCode = 64;
        } else if (args.length == 1) {
            exitCode = runFile(args[0]);
        } else {
            exitCode = runPrompt();
        }
        System.exit(exitCode);
    }

    private static int runFile(String path) throws IOException {
        byte[] bytes;
        if ("-".equals(path)) {
            bytes = System.in.readAllBytes();
        } else {
            bytes = Files.readAllBytes(Paths.get(path));
        }

        var flags = new Flags();
        flags.printSource = true;
        return run(new String(bytes, Charset.defaultCharset()), flags, System.out, System.err);
    }

    private static int runPrompt() throws IOException {
        var reader = new BufferedReader(new InputStreamReader(System.in));

        var lineBuffer = new ArrayList<String>();
        var flags = new Flags();
        flags.printAst = true;
        for (;;) {
            var prompt = String.format(":%02d> ", lineBuffer.size());
            System.out.print(prompt);
            var line = reader.readLine();

            if (line == null || ":q".equals(line)) {
                break;
            } else if (":b".equals(line)) {
                int n = 0;
                for (var l : lineBuffer) {
                    System.out.println(String.format("%02d  %s", ++n, l));
                }
            } else if (line.startsWith(":tok")) {
                flags.printTokens = toggle(line, ":tok", flags.printTokens);
                System.out.println("print tokens: " + flags.printTokens);
            } else if (line.startsWith(":ast")) {
                flags.printAst = toggle(line, ":ast", flags.printAst);
                System.out.println("print ast: " + flags.printAst);
            } else if (line.startsWith(":src")) {
                flags.printSource = toggle(line, ":src", flags.printSource);
                System.out.println("print source: " + flags.printSource);
            } else if (line.isBlank() && !lineBuffer.isEmpty()) {
                flush(lineBuffer, flags);
            } else if (!line.isBlank()) {
                lineBuffer.add(line);
                if (!isPending(lineBuffer)) {
                    flush(lineBuffer, flags);
                }
            }
        }
        return 0;
    }

    private static boolean toggle(String line, String command, boolean current) {
        var arg = line.substring(command.length()).trim();
        return arg.isBlank() ? current : Boolean.parseBoolean(arg);
    }

    /**
     * An input is pending while a block is open or its last line is
     * continued: after a trailing colon, once an indented line has been
     * entered (the user ends the block with an empty line), or after a
     * trailing backslash.
     */
    static boolean isPending(List<String> lines) {
        Token last = null;
        for (var token : Lexer.tokenize(String.join("\n", lines)).tokens()) {
            switch (token.type()) {
            case INDENT:
                return true;
            case NEW_LINE:
            case DEDENT:
            case EOF:
                break;
            default:
                last = token;
            }
        }
        return last != null && (last.is(COLON) || (last.is(UNKNOWN) && "\\".equals(last.lexeme())));
    }

    private static void flush(List<String> lineBuffer, Flags flags) {
        var source = String.join("\n", lineBuffer) + "\n";
        run(source, flags, System.out, System.err);
        lineBuffer.clear();
    }

    static int run(String source, Flags flags, PrintStream out, PrintStream err) {
        var lexed = Lexer.tokenize(source);

        if (flags.printTokens) {
            lexed.tokens().forEach(out::println);
        }

        lexed.warnings().forEach(warning -> report(err, warning));
        lexed.errors().forEach(error -> report(err, error));

        var parsed = Parser.parse(lexed.tokens());

        if (flags.printAst) {
            out.print(DebugPrinter.print(parsed.root()));
        }
        if (flags.printSource) {
            out.print(parsed.root().toSource());
        }

        parsed.errors().forEach(error -> report(err, error));

        return lexed.hasErrors() || parsed.hasErrors() ? 1 : 0;
    }

    private static void report(PrintStream err, Lexer.Message message) {
        err.println("scanner: " + message.message() + " [line " + message.line() + ", col " + message.column() + "]");
    }

    private static void report(PrintStream err, ParseError error) {
        err.println("parser: " + error);
    }

    static class Flags {
        boolean printTokens = false;
        boolean printAst = false;
        boolean printSource = false;
    }
}
