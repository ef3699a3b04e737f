package io.github.eutro.scriptlift.api;

import io.github.eutro.scriptlift.core.cfg.display.CfgDisplay;
import io.github.eutro.scriptlift.core.script.SimpleScriptObject;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class Cli {
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    /**
     * Run the command line.
     *
     * @param args The arguments.
     * @param out  Where to print results.
     * @param err  Where to print errors.
     * @return The exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> paths = new ArrayList<>();
        DecompilerConfig.Builder config = DecompilerConfig.defaults().toBuilder();
        boolean showCfg = false;
        boolean showDot = false;
        boolean showLiveness = false;
        boolean suppressFlags = false;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp(out);
                        return 0;
                    case "--deep":
                        config.setDeepAnalysis(true);
                        break;
                    case "--max-iterations":
                        if (i == args.length) {
                            err.printf("%s: expected number%n", arg);
                            return 1;
                        }
                        String value = args[i++];
                        try {
                            config.setIterationCap(Integer.parseInt(value));
                        } catch (IllegalArgumentException e) {
                            err.printf("%s: invalid iteration cap \"%s\"%n", arg, value);
                            return 1;
                        }
                        break;
                    case "--cfg":
                        showCfg = true;
                        break;
                    case "--dot":
                        showDot = true;
                        break;
                    case "--liveness":
                        showLiveness = true;
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            paths.add(arg);
        }
        if (paths.isEmpty()) {
            printHelp(err);
            return 1;
        }

        Decompiler decompiler = new Decompiler(config.build());
        int status = 0;
        for (String spec : paths) {
            Path path = Paths.get(spec);
            String text;
            try {
                text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.printf("could not read file %s: %s%n", spec, e);
                status = 1;
                continue;
            }
            if (paths.size() > 1) out.printf("-- %s%n", spec);

            DecompileResult result = decompiler.decompile(SimpleScriptObject.builder(String.valueOf(path.getFileName()))
                    .source(text)
                    .property("path", spec)
                    .build());
            if (!result.isAvailable()) {
                out.println("-- no instructions available");
                continue;
            }
            out.println(result.getSource());
            if (showCfg) out.print(CfgDisplay.listing(result.getCfg()));
            if (showDot) out.print(CfgDisplay.toDot(result.getCfg()));
            if (showLiveness) out.print(CfgDisplay.liveness(result.getDataFlow()));
        }
        return status;
    }

    private static void printHelp(PrintStream out) {
        out.println(
                "usage: scriptlift [-h|--help] [--deep] [--max-iterations <n>] [--cfg] [--dot] [--liveness] [--] <file> ...\n" +
                        "\n" +
                        "  <file> : a script to decompile; its reconstructed source is printed\n" +
                        "  --deep : allow sampling execution traces from a reflection host\n" +
                        "  --max-iterations <n> : cap liveness analysis at <n> rounds (default 100)\n" +
                        "  --cfg : also print the basic blocks\n" +
                        "  --dot : also print the control flow graph in Graphviz dot format\n" +
                        "  --liveness : also print the live slots of each block\n" +
                        "  -h|--help : show this help"
        );
    }
}
