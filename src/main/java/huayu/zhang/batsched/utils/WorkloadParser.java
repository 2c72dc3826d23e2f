package huayu.zhang.batsched.utils;

import huayu.zhang.batsched.simulator.SimulatedJob;
import huayu.zhang.batsched.simulator.Workload;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.*;
import java.util.logging.Logger;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Reads a batch workload: {@code nb_res}, a {@code jobs} array ({@code id},
 * {@code res}, {@code walltime}, {@code subtime}, {@code profile}) and the
 * {@code profiles} giving each job's actual {@code delay}.
 */
public class WorkloadParser {
  private static Logger LOG = Logger.getLogger(WorkloadParser.class.getName());

  private JSONParser parser_;

  public WorkloadParser() {
    parser_ = new JSONParser();
  }

  public Workload parseWorkloadFile(String filePath) throws IOException {
    try (FileReader fr = new FileReader(filePath)) {
      Workload workload = parseWorkload(fr);
      LOG.info("parse workload file " + filePath + ": " + workload.getJobs().size() + " jobs on "
          + workload.getNumResources() + " hosts");
      return workload;
    }
  }

  public Workload parseWorkload(Reader reader) throws IOException {
    JSONObject jWorkload;
    try {
      jWorkload = (JSONObject) parser_.parse(reader);
    } catch (ParseException | ClassCastException e) {
      throw new IllegalArgumentException("Malformed workload: " + e, e);
    }
    int numResources = Integer.parseInt(required(jWorkload, "nb_res").toString());
    Object description = jWorkload.get("description");
    JSONObject jProfiles = (JSONObject) jWorkload.get("profiles");
    if (jProfiles == null) {
      jProfiles = new JSONObject();
    }

    List<SimulatedJob> jobs = new ArrayList<>();
    for (Object o : (JSONArray) required(jWorkload, "jobs")) {
      JSONObject jJob = (JSONObject) o;
      String id = required(jJob, "id").toString();
      int res = Integer.parseInt(required(jJob, "res").toString());
      double subtime = Double.parseDouble(required(jJob, "subtime").toString());
      double walltime = jJob.get("walltime") == null ? -1
          : Double.parseDouble(jJob.get("walltime").toString());
      double delay = walltime;
      Object profileName = jJob.get("profile");
      if (profileName != null && jProfiles.get(profileName.toString()) != null) {
        JSONObject jProfile = (JSONObject) jProfiles.get(profileName.toString());
        if (jProfile.get("delay") != null) {
          delay = Double.parseDouble(jProfile.get("delay").toString());
        }
      }
      if (delay < 0) {
        throw new IllegalArgumentException("Job " + id + " has neither a walltime nor a delay profile");
      }
      jobs.add(new SimulatedJob(id, res, walltime, subtime, delay));
    }
    jobs.sort(Comparator.comparingDouble(SimulatedJob::getSubmissionTime));
    return new Workload(numResources, description == null ? "" : description.toString(), jobs);
  }

  private static Object required(JSONObject jObj, String key) {
    Object value = jObj.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing field '" + key + "' in workload");
    }
    return value;
  }
}
