package com.falba.cli;

import com.falba.config.FalbaProperties;
import com.falba.model.Corpus;
import com.falba.pipeline.CorpusReadException;
import com.falba.pipeline.CorpusReader;
import com.falba.pipeline.PhaseReport;
import com.falba.pipeline.PipelineIssue;
import com.falba.pipeline.PipelineService;
import com.falba.query.MatchReport;
import com.falba.query.QueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * {@code falba ab <expr> [--result-db=<dir>]}: reads the corpus, runs enrichment
 * and derivation, then prints {@code testName/runId} for every run the
 * expression matches.
 *
 * Exit codes:
 * <ul>
 *   <li>0: the query ran, whether or not anything matched</li>
 *   <li>1: the corpus root is unreadable or holds no runs</li>
 *   <li>2: invalid command line</li>
 * </ul>
 * Started without arguments the command does nothing, so the context can be
 * brought up on its own.
 */
@Component
public class QueryCommand implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(QueryCommand.class);

    static final String COMMAND = "ab";
    static final String RESULT_DB_OPTION = "result-db";
    static final String USAGE = "usage: falba ab <expr> [--result-db=<dir>]";

    static final int EXIT_CORPUS = 1;
    static final int EXIT_USAGE = 2;

    private final FalbaProperties properties;
    private final CorpusReader corpusReader;
    private final PipelineService pipeline;
    private final QueryService queryService;
    private final PrintStream out;

    private int exitCode;

    @Autowired
    public QueryCommand(FalbaProperties properties, CorpusReader corpusReader,
                        PipelineService pipeline, QueryService queryService) {
        this(properties, corpusReader, pipeline, queryService, System.out);
    }

    QueryCommand(FalbaProperties properties, CorpusReader corpusReader,
                 PipelineService pipeline, QueryService queryService, PrintStream out) {
        this.properties = properties;
        this.corpusReader = corpusReader;
        this.pipeline = pipeline;
        this.queryService = queryService;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            log.debug("No command given");
            return;
        }
        if (!COMMAND.equals(positional.get(0)) || positional.size() != 2 || positional.get(1).isBlank()) {
            log.error("Invalid arguments {}; {}", positional, USAGE);
            exitCode = EXIT_USAGE;
            return;
        }
        exitCode = execute(positional.get(1), resultDb(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String expression, Path resultDb) {
        Corpus corpus;
        try {
            corpus = corpusReader.read(resultDb);
        } catch (CorpusReadException ex) {
            log.error("Cannot read result database: {}", ex.getMessage());
            return EXIT_CORPUS;
        }
        if (corpus.isEmpty()) {
            log.error("No runs found under {}", resultDb);
            return EXIT_CORPUS;
        }

        logIssues(pipeline.applyEnrichers(corpus));
        logIssues(pipeline.applyDerivers(corpus));

        MatchReport report = queryService.query(corpus, expression);
        report.lines().forEach(out::println);
        out.flush();
        return 0;
    }

    private Path resultDb(ApplicationArguments args) {
        if (args.containsOption(RESULT_DB_OPTION)) {
            List<String> values = args.getOptionValues(RESULT_DB_OPTION);
            if (!values.isEmpty() && !values.get(values.size() - 1).isBlank()) {
                return Path.of(values.get(values.size() - 1));
            }
        }
        return properties.getResultDb();
    }

    private static void logIssues(PhaseReport report) {
        for (PipelineIssue issue : report.issues()) {
            if (issue.severity() == PipelineIssue.Severity.ERROR) {
                log.error("{}: {}", report.phase(), issue);
            } else {
                log.warn("{}: {}", report.phase(), issue);
            }
        }
    }
}
