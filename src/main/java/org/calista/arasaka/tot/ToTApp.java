package org.calista.arasaka.tot;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.tot.core.ToTComposer;
import org.calista.arasaka.tot.core.ToTKernel;
import org.calista.arasaka.tot.durable.SearchInterruptedException;
import org.calista.arasaka.tot.model.Branch;
import org.calista.arasaka.tot.model.SearchOutcome;
import org.calista.arasaka.tot.model.SearchResult;
import org.calista.arasaka.tot.search.SearchLogFmt;
import org.calista.arasaka.tot.search.TreeOfThoughts;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;

/**
 * ToTApp: interactive console runner.
 *
 * Lifecycle:
 *  1) build kernel (config, data dir, store)
 *  2) compose TreeOfThoughts (owns its call pool)
 *  3) resume searches interrupted by a previous run
 *  4) read problems line by line, one search each
 *  5) close TreeOfThoughts + kernel
 */
public final class ToTApp {

    private static final Logger log = LogManager.getLogger(ToTApp.class);

    private final Path cfgPath;
    private ToTKernel kernel;
    private TreeOfThoughts tot;

    public static void main(String[] args) throws Exception {
        new ToTApp(args.length > 0 ? Path.of(args[0]) : Path.of("config/tot.json")).run();
    }

    public ToTApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    public void run() throws IOException {
        try {
            kernel = ToTKernel.builder()
                    .configRoot(Path.of("."))
                    .build(cfgPath);

            tot = new ToTComposer(kernel).buildTreeOfThoughts();

            resumeInFlight();
            runConsoleLoop();
        } finally {
            shutdown();
        }
    }

    private void resumeInFlight() {
        List<String> ids = tot.inFlightSearchIds();
        if (ids.isEmpty()) return;
        log.info("Resuming {} interrupted search(es): {}", ids.size(), ids);
        for (String id : ids) {
            SearchOutcome out = tot.resume(id);
            System.out.println(render(out));
        }
    }

    private void runConsoleLoop() {
        log.info("Tree-of-thoughts search ready. Type a problem, or 'exit' to quit.\n");

        try (Scanner sc = new Scanner(System.in)) {
            while (true) {
                System.out.print("> ");
                if (!sc.hasNextLine()) break;
                String problem = sc.nextLine().trim();
                if (problem.equalsIgnoreCase("exit")) break;
                if (problem.isEmpty()) continue;

                try {
                    SearchOutcome out = tot.submit(problem);
                    System.out.println("\n" + render(out) + "\n");
                } catch (IllegalArgumentException e) {
                    log.warn("Rejected: {}", e.getMessage());
                } catch (SearchInterruptedException e) {
                    log.warn("Search interrupted; it will be resumed on next start", e);
                    break;
                }
            }
        }
        System.out.println("Bye.");
    }

    static String render(SearchOutcome out) {
        if (!out.isCompleted()) {
            return SearchLogFmt.box("Search " + out.searchId + " failed", b -> {
                b.kv("reason", out.reason);
                b.kv("message", out.message);
            });
        }
        SearchResult r = out.result;
        return SearchLogFmt.box("Search " + r.searchId, b -> {
            b.kv("answer", r.answer);
            b.sep();
            b.kv("score", String.format(Locale.ROOT, "%.3f", r.score));
            b.kv("depth", r.depth);
            b.kv("explored", r.totalBranchesExplored);
            b.kv("fallback", r.fallback);
            b.sep();
            StringBuilder chain = new StringBuilder();
            for (Branch step : r.path) {
                if (chain.length() > 0) chain.append('\n');
                chain.append("[").append(step.id).append("] ").append(step.content);
            }
            b.text(chain.toString());
        });
    }

    private void shutdown() {
        if (tot != null) tot.close();
        if (kernel != null) kernel.close();
    }
}
