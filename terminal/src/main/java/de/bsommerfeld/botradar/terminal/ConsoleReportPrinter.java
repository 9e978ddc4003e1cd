package de.bsommerfeld.botradar.terminal;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.botradar.core.domain.AccountCluster;
import de.bsommerfeld.botradar.core.domain.SuspicionReport;
import de.bsommerfeld.botradar.core.event.DetectionEvents;

import java.io.PrintStream;

/**
 * Prints completed reports as plain text. Registered on the event bus by
 * {@link BotRadarMain}.
 */
public class ConsoleReportPrinter {

    private final PrintStream out;

    public ConsoleReportPrinter(PrintStream out) {
        this.out = out;
    }

    @Subscribe
    public void onReportCompleted(DetectionEvents.ReportCompletedEvent event) {
        print(event.report());
    }

    @Subscribe
    public void onAnalysisFailed(DetectionEvents.AnalysisFailedEvent event) {
        out.println("Analysis failed in " + event.detector() + ": " + event.message());
    }

    void print(SuspicionReport report) {
        out.println("Suspicious accounts: " + report.suspiciousAccounts());
        out.println("Repeated phrases:    " + report.repeatedPhrases());
        out.println(String.format("Average sentiment:   %.3f", report.averageSentiment()));
        out.println("Suspicious clusters: " + report.suspiciousClusters().size());
        for (AccountCluster cluster : report.suspiciousClusters()) {
            out.println("  [" + cluster.size() + "] " + String.join(", ", cluster.members()));
        }
    }
}
