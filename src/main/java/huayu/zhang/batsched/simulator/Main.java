package huayu.zhang.batsched.simulator;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import huayu.zhang.batsched.utils.Configuration;
import huayu.zhang.batsched.utils.ConfigurationException;
import huayu.zhang.batsched.utils.WorkloadParser;

import org.json.simple.JSONObject;

public class Main {

  private static Logger LOG = Logger.getLogger(Main.class.getName());

  public static void main(String[] args) {
    String UsageStr = "Usage: java huayu.zhang.batsched.simulator.Main pathToConfig pathToWorkload";
    if (args.length != 2) {
      System.err.println(UsageStr + ", args.length=" + args.length);
      System.exit(2);
    }
    String pathToConfig = args[0];
    String pathToWorkload = args[1];

    configureLogging();

    Configuration config = new Configuration();
    Workload workload;
    try {
      config.parseConfigFile(pathToConfig);
      workload = new WorkloadParser().parseWorkloadFile(pathToWorkload);
    } catch (ConfigurationException | IOException | IllegalArgumentException e) {
      LOG.severe("Cannot start simulation: " + e.getMessage());
      System.exit(1);
      return;
    }

    // print ALL parameters for the record
    System.out.println("=====================");
    System.out.println("Simulation Parameters");
    System.out.println("=====================");
    System.out.println("pathToWorkload    = " + pathToWorkload);
    System.out.println("pathToConfigFile  = " + pathToConfig);
    System.out.println("policy            = " + config.getSchedPolicy());
    System.out.println("hosts             = " + workload.getNumResources());
    System.out.println("jobs              = " + workload.getJobs().size());
    System.out.println("=====================\n");

    LOG.info("Start simulation ...");
    JSONObject jStats;
    try {
      Simulator simulator = new Simulator(workload, config);
      jStats = simulator.simulate();
      Simulator.writeStatistics(jStats, config.getStatsOutput());
    } catch (ConfigurationException | IOException e) {
      LOG.severe("Simulation failed: " + e.getMessage());
      System.exit(1);
      return;
    }
    LOG.info("End simulation ...");

    System.out.println("==== Final Report ====");
    System.out.println("Completed jobs:" + jStats.get("completed") + ", rejected jobs:" + jStats.get("rejected"));
    System.out.println("Makespan:" + jStats.get("makespan"));
    System.out.println("Avg. waiting time:" + jStats.get("mean_waiting_time"));
    System.out.println("Avg. turnaround time:" + jStats.get("mean_turnaround_time"));
    System.out.println("Backfilling:" + jStats.get("backfilling"));
  }

  private static void configureLogging() {
    try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    } catch (IOException e) {
      System.err.println("Cannot load logging.properties: " + e);
    }
  }
}
