package org.unifi.petri;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unifi.petri.analysis.AnalysisReport;
import org.unifi.petri.exceptions.PetriNetException;
import org.unifi.petri.io.NetFileReader;
import org.unifi.petri.model.PetriNet;

public class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        AppConfig config;
        try {
            config = AppConfig.load(args, System.getenv());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: App <net-file>");
            System.exit(2);
            return;
        }
        System.exit(run(config));
    }

    static int run(AppConfig config) {
        try {
            PetriNet net = new NetFileReader().read(config.getNetFile());
            AnalysisReport report = AnalysisReport.of(net);
            System.out.println(config.getFormat() == AppConfig.ReportFormat.JSON ? report.toJson() : report.toText());
            return 0;
        } catch (IOException e) {
            LOG.error("Cannot read {}", config.getNetFile(), e);
            return 1;
        } catch (PetriNetException e) {
            LOG.error("Invalid net in {}: {}", config.getNetFile(), e.getMessage());
            return 1;
        }
    }
}
