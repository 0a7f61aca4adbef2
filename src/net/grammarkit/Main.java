package net.grammarkit;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.grammarkit.api.parser.MappingException;
import net.grammarkit.api.parser.ParseTree;
import net.grammarkit.grammar.Production;
import net.grammarkit.grammar.Symbol;
import net.grammarkit.grammar.Terminal;
import net.grammarkit.grammar.TreeTransformer;
import net.grammarkit.util.Logging;
import net.grammarkit.util.config.DynamicConfiguration;
import net.grammarkit.util.parser.JSONParseTrees;

public class Main {

    public static final String LOG_LEVEL_KEY = "grammarkit.log.level";

    private static final Logger LOGGER = Logger.getLogger("Main");

    public static String formatProduction(Production p) {
        if (p.isEmpty()) return "<empty>";
        StringBuilder sb = new StringBuilder();
        for (Symbol s : p.getSymbols()) {
            if (sb.length() > 0) sb.append(' ');
            if (s instanceof Terminal) {
                sb.append('\'').append(s.getText()).append('\'');
            } else {
                sb.append(s.getText());
            }
        }
        return sb.toString();
    }

    public static List<Production> transformFile(String filename,
            DynamicConfiguration config) throws IOException,
            MappingException {
        ParseTree tree;
        Reader input = new InputStreamReader(new FileInputStream(filename),
                                             StandardCharsets.UTF_8);
        try {
            tree = JSONParseTrees.parse(input);
        } finally {
            input.close();
        }
        List<Production> ret = new TreeTransformer(config)
            .transformProductions(tree);
        for (Production p : ret) p.freeze();
        LOGGER.info("Transformed " + ret.size() + " productions from " +
            filename);
        return ret;
    }

    public static int run(String[] args, DynamicConfiguration config,
                          PrintStream out, PrintStream err) {
        /* Parse command line */
        String filename = null;
        boolean usageError = false;
        for (String a : args) {
            if (a.equals("--strict")) {
                config.put(TreeTransformer.STRICT_PRODUCTIONS_KEY, "true");
            } else if (a.startsWith("-") || filename != null) {
                usageError = true;
            } else {
                filename = a;
            }
        }
        if (usageError || filename == null) {
            err.println("USAGE: grammarkit [--strict] treefile.json");
            return 1;
        }
        /* Do the work */
        try {
            for (Production p : transformFile(filename, config)) {
                out.println(formatProduction(p));
            }
        } catch (IOException exc) {
            err.println(exc);
            return 2;
        } catch (MappingException exc) {
            err.println(exc);
            return 2;
        }
        return 0;
    }

    public static void main(String[] args) {
        DynamicConfiguration config = DynamicConfiguration.makeDefault();
        Logging.initFormat();
        Logging.redirectToStream(System.err,
            Logging.parseLevel(config.get(LOG_LEVEL_KEY), Level.WARNING));
        System.exit(run(args, config, System.out, System.err));
    }

}
