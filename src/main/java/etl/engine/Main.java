package etl.engine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import etl.engine.cli.EngineConfig;
import etl.engine.cli.StatementReader;
import etl.engine.cli.TablePrinter;
import etl.engine.data.Relation;
import etl.engine.error.QueryException;
import etl.engine.query.QueryProcessor;
import etl.engine.source.MemorySource;
import etl.engine.source.SourceRegistry;

public class Main {
    public static void main(String[] args) {
        EngineConfig config = EngineConfig.fromArgs(args);
        System.err.println("[Main] " + config);

        SourceRegistry sources = SourceRegistry.withDefaults(config.dataDir, config.csvDelimiter, new MemorySource());
        QueryProcessor qp = new QueryProcessor(sources);

        if (!config.interactive()) {
            int failures = runScript(qp, config);
            if (failures > 0) System.exit(1);
            return;
        }

        System.out.println("Query mode (end statements with ';', 'exit' to quit)\n");
        StatementReader reader = new StatementReader();
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            while (true) {
                System.out.print(reader.isEmpty() ? config.prompt : continuation(config.prompt));
                String line = in.readLine();
                if (line == null) break;
                if (reader.isEmpty() && line.trim().equalsIgnoreCase("exit")) {
                    System.out.println("Exiting query mode");
                    break;
                }
                String stmt = reader.feed(line);
                while (stmt != null) {
                    run(qp, stmt, config.maxDisplayRows);
                    stmt = reader.poll();
                }
            }
        } catch (IOException e) {
            System.err.println("[Main] Failed reading input: " + e.getMessage());
        }
    }

    private static int runScript(QueryProcessor qp, EngineConfig config) {
        String text;
        try {
            text = Files.readString(config.scriptFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("[Main] Could not read script " + config.scriptFile + ": " + e.getMessage());
            return 1;
        }
        StatementReader reader = new StatementReader();
        int failures = 0;
        String stmt = reader.feed(text);
        while (stmt != null) {
            if (!run(qp, stmt, config.maxDisplayRows)) failures++;
            stmt = reader.poll();
        }
        String rest = reader.drain();
        if (!rest.isEmpty()) {
            System.err.println("[Main] Ignoring unterminated statement at end of script: " + rest);
        }
        return failures;
    }

    private static boolean run(QueryProcessor qp, String stmt, int maxRows) {
        try {
            Relation result = qp.execute(stmt);
            TablePrinter.print(result, maxRows);
            return true;
        } catch (QueryException ex) {
            System.out.println("Error [" + ex.kind() + "]: " + ex.getMessage());
            return false;
        } catch (RuntimeException ex) {
            System.out.println("Error: " + ex.getMessage());
            return false;
        }
    }

    private static String continuation(String prompt) {
        String trimmed = prompt.stripTrailing();
        return " ".repeat(Math.max(0, trimmed.length() - 2)) + "-> ";
    }
}
