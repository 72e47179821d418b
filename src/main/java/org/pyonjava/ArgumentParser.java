package org.pyonjava;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * and configuring the CompilerOptions accordingly. It handles the flags that
 * select what the tool prints (tokens, the tree, or regenerated source) and
 * the layout of generated code.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a CompilerOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A CompilerOptions object with settings derived from the arguments.
     * @throws IllegalArgumentException for an unknown switch, a missing switch value
     *                                  or an unreadable file
     */
    public static CompilerOptions parseArguments(String[] args) {
        CompilerOptions parsedArgs = new CompilerOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-")) {
                readSource(parsedArgs, arg);
                continue;
            }
            switch (arg) {
                case "-c":
                    parsedArgs.code = requireValue(args, ++i, arg);
                    parsedArgs.fileName = "<command line>";
                    break;
                case "--debug":
                    parsedArgs.debugEnabled = true;
                    break;
                case "--tokenize":
                    validateExclusiveOptions(parsedArgs, "tokenize");
                    parsedArgs.tokenizeOnly = true;
                    break;
                case "--parse":
                    validateExclusiveOptions(parsedArgs, "parse");
                    parsedArgs.parseOnly = true;
                    break;
                case "--tab-size":
                    parsedArgs.tabSize = requirePositive(args, ++i, arg);
                    break;
                case "--indent":
                    parsedArgs.indentSize = requirePositive(args, ++i, arg);
                    break;
                case "--single-quotes":
                    parsedArgs.useSingleQuotes = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unrecognized switch: " + arg + "  (-h will show valid options)");
            }
        }
        if (parsedArgs.code == null) {
            throw new IllegalArgumentException("No input: give a file name or -c code");
        }
        return parsedArgs;
    }

    private static void readSource(CompilerOptions parsedArgs, String fileName) {
        if (parsedArgs.code != null) {
            throw new IllegalArgumentException("Only one input is accepted, got " + fileName);
        }
        parsedArgs.fileName = fileName;
        try {
            parsedArgs.code = new String(Files.readAllBytes(Paths.get(fileName)), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to read file " + fileName, e);
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value after " + option);
        }
        return args[index];
    }

    private static int requirePositive(String[] args, int index, String option) {
        String value = requireValue(args, index, option);
        try {
            int number = Integer.parseInt(value);
            if (number > 0) {
                return number;
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected a number after " + option + " but got " + value, e);
        }
        throw new IllegalArgumentException("Expected a positive number after " + option + " but got " + value);
    }

    /**
     * Validates that exclusive options are not combined.
     */
    private static void validateExclusiveOptions(CompilerOptions parsedArgs, String option) {
        if (parsedArgs.tokenizeOnly || parsedArgs.parseOnly) {
            throw new IllegalArgumentException("--" + option + " cannot be combined with other exclusive options");
        }
    }

    /**
     * Whether the arguments ask for the help text instead of a run.
     */
    public static boolean isHelpRequest(String[] args) {
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                return true;
            }
        }
        return false;
    }

    public static String helpText() {
        return "Usage: java -jar target/pyonjava-" + Configuration.jarVersion + ".jar [options] [file]\n" +
                "\n" +
                "Reads the file (or the -c code), checks it against the " + Configuration.grammarVersion + " grammar\n" +
                "and prints it back in canonical layout.\n" +
                "\n" +
                "  -c code               source given on the command line\n" +
                "  --tokenize            print the tokens only\n" +
                "  --parse               print the syntax tree only\n" +
                "  --tab-size n          indentation width of a tab (default " + Configuration.defaultTabSize + ")\n" +
                "  --indent n            indentation width of generated code (default " + Configuration.defaultIndentSize + ")\n" +
                "  --single-quotes       prefer ' for generated string literals\n" +
                "  --debug               enable debugging mode\n" +
                "  -h, --help            displays this help message\n";
    }
}
