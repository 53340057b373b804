package com.clawweb.app.cli;

import com.clawweb.app.export.LinkGraphExporter;
import com.clawweb.app.logging.LogSetup;
import com.clawweb.core.crawler.Crawler;
import com.clawweb.core.crawler.HttpPageFetcher;
import com.clawweb.core.model.CrawlConfig;
import com.clawweb.core.model.CrawlResult;
import com.clawweb.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;

@Command(name = "clawweb",
        mixinStandardHelpOptions = true,
        version = "clawweb 0.1.0",
        description = "Breadth-first crawl of a single host, starting from URL.")
public class ClawWebCli implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(ClawWebCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_CONFIG = 2;
    public static final int EXIT_OUTPUT = 3;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "URL", description = "Root URL to start from.")
    String url;

    @Option(names = {"-l", "--links"}, description = "Get links for specified url only.")
    boolean linksOnly;

    @Option(names = {"-d", "--depth"}, paramLabel = "N",
            description = "Maximum depth to traverse (default: " + CrawlConfig.DEFAULT_MAX_DEPTH + ").")
    Integer depth;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE", description = "YAML crawl configuration.")
    Path configFile;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write the link graph as JSON.")
    Path output;

    @Option(names = {"-v", "--verbose"}, description = "Log per-page diagnostics (INFO level).")
    boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) LogSetup.setLevel(Level.INFO);

        CrawlConfig cfg;
        try {
            cfg = (configFile != null) ? YamlConfigLoader.load(configFile) : CrawlConfig.defaults();
        } catch (IOException e) {
            err.println("Invalid config: " + e.getMessage());
            return EXIT_CONFIG;
        }
        // CLI 값이 설정 파일보다 우선
        if (url != null) cfg.setTarget(url);
        if (depth != null) cfg.setMaxDepth(depth);

        if (cfg.getTarget() == null || cfg.getTarget().isBlank()) {
            spec.commandLine().usage(err);
            return EXIT_USAGE;
        }
        try {
            cfg.validate();
        } catch (IllegalArgumentException e) {
            err.println("Invalid config: " + e.getMessage());
            return EXIT_CONFIG;
        }

        if (linksOnly) {
            new LinkLister(new HttpPageFetcher(cfg)).list(cfg.getTarget(), out);
            return EXIT_OK;
        }

        err.println("Crawling " + cfg.getTarget() + " (Max Depth: " + cfg.getMaxDepth() + ")");
        CrawlResult result = new Crawler(cfg).crawl();
        err.println("Found:    " + result.numLinks());
        err.println("Followed: " + result.numFollowed());
        err.flush();

        if (output != null) {
            try {
                new LinkGraphExporter().export(result, output);
                LOG.info("Wrote link graph to {}", output.toAbsolutePath());
            } catch (IOException e) {
                err.println("Can't write " + output + ": " + e.getMessage());
                return EXIT_OUTPUT;
            }
        }
        return EXIT_OK;
    }

    /** 테스트/임베딩용 진입점: 로그 설정은 건드리지 않는다. */
    public static int run(PrintWriter out, PrintWriter err, String... args) {
        CommandLine cmd = new CommandLine(new ClawWebCli());
        cmd.setOut(out);
        cmd.setErr(err);
        cmd.setParameterExceptionHandler((ex, a) -> {
            CommandLine c = ex.getCommandLine();
            c.getErr().println(ex.getMessage());
            c.usage(c.getErr());
            return EXIT_USAGE;
        });
        return cmd.execute(args);
    }

    public static void main(String[] args) {
        LogSetup.init();
        int code = run(new PrintWriter(System.out, true), new PrintWriter(System.err, true), args);
        System.exit(code);
    }
}
