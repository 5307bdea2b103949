package com.jqdsl;

import com.jqdsl.load.DocumentLoader;
import com.jqdsl.query.Queryable;
import com.jqdsl.tree.Scalars;
import com.jqdsl.tree.TreeBuilder;
import org.eclipse.collections.api.tuple.Pair;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "jqdsl", mixinStandardHelpOptions = true, version = "1.0",
         description = "Load JSON and YAML documents and explore them as one tree")
public class JQDSL implements Callable<Integer> {
    @Parameters(arity = "1..*", description = "Files, directories or http(s) URLs to load")
    private List<String> paths;

    @Option(names = {"-v", "--verbose"}, description = "Log debug diagnostics")
    private boolean verbose = false;

    @Option(names = {"-i", "--ignore"}, description = "Skip paths matching this regex (default: ${DEFAULT-VALUE})")
    private String ignore = DocumentLoader.DEFAULT_IGNORE;

    @Option(names = {"-f", "--find"}, description = "Search for nodes with this name anywhere; repeat to chain")
    private List<String> finds = new ArrayList<>();

    @Option(names = {"-k", "--keys"}, description = "Print the names of the children of the selected nodes")
    private boolean keys = false;

    @Option(names = {"-c", "--crumbs"}, description = "Print the paths of the selected nodes")
    private boolean crumbs = false;

    @Option(names = {"-d", "--down"}, description = "With --crumbs, print paths below the selected nodes")
    private boolean down = false;

    @Option(names = {"-u", "--values"}, description = "Print the values of the selected nodes by frequency")
    private boolean values = false;

    @Option(names = {"-s", "--sources"}, description = "Print the documents the selected nodes come from")
    private boolean sources = false;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JQDSL()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            if (verbose) {
                System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
            }

            DocumentLoader loader = new DocumentLoader(ignore, TreeBuilder.ROOT_NAME);
            Queryable result = loader.analyze(paths);
            if (!finds.isEmpty()) {
                result = result.find(finds.toArray());
            }

            PrintWriter out = spec.commandLine().getOut();
            if (keys) {
                for (String key : result.keys()) {
                    out.println(key);
                }
            } else if (crumbs) {
                for (String crumb : result.crumbs(down)) {
                    out.println(crumb);
                }
            } else if (values) {
                for (Pair<Object, Integer> entry : result.mostCommon()) {
                    out.println(Scalars.render(entry.getOne()) + "\t" + entry.getTwo());
                }
            } else if (sources) {
                for (String source : result.sources()) {
                    out.println(source);
                }
            } else {
                out.print(result);
            }
            out.flush();

            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
