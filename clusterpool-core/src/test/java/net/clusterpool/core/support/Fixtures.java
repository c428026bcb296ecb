package net.clusterpool.core.support;

import net.clusterpool.core.model.Cluster;
import net.clusterpool.core.model.Credentials;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.model.WorkUnit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Fixtures {
    private Fixtures() {}

    public static Credentials credentials(String accessKeyId) {
        return new Credentials(Credentials.AccessKey.of(accessKeyId, "secret-" + accessKeyId), null);
    }

    public static Credentials credentials() { return credentials("AKIATESTKEY0001"); }

    /** EMR-style job flow with a master and a core instance group */
    public static Map<String, Object> jobFlow(String name) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("Name", name);
        doc.put("ReleaseLabel", "emr-6.15.0");
        doc.put("LogUri", FakeControlPlane.LOG_URI);
        Map<String, Object> instances = new LinkedHashMap<>();
        instances.put("InstanceGroups", List.of(group("MASTER", "m5.xlarge", 1), group("CORE", "r5.2xlarge", 2)));
        instances.put("KeepJobFlowAliveWhenNoSteps", true);
        doc.put("Instances", instances);
        doc.put("BootstrapActions", List.of(Map.of("Name", "install-deps",
                "ScriptBootstrapAction", Map.of("Path", "s3://scripts.example/bootstrap.sh"))));
        return doc;
    }

    private static Map<String, Object> group(String role, String type, int count) {
        Map<String, Object> volume = new LinkedHashMap<>();
        volume.put("VolumeType", "gp2");
        volume.put("SizeInGB", 64);
        Map<String, Object> device = new LinkedHashMap<>();
        device.put("VolumeSpecification", volume);
        device.put("VolumesPerInstance", 1);
        Map<String, Object> g = new LinkedHashMap<>();
        g.put("InstanceRole", role);
        g.put("InstanceType", type);
        g.put("InstanceCount", count);
        g.put("EbsConfiguration", Map.of("EbsBlockDeviceConfigs", List.of(device)));
        return g;
    }

    public static LaunchConfig launchConfig(String name) { return LaunchConfig.of(jobFlow(name)); }

    public static Map<String, Object> workSpec(String name) {
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("Name", name);
        spec.put("ActionOnFailure", "CONTINUE");
        spec.put("HadoopJarStep", Map.of("Jar", "command-runner.jar",
                "Args", List.of("spark-submit", "s3://scripts.example/" + name + ".py")));
        return spec;
    }

    public static WorkUnit unit(String name, LaunchConfig config, Instant now) throws Exception {
        return WorkUnit.create("alice", workSpec(name), Map.of("team", "data"), credentials(), config, false, now);
    }

    /** a scheduler-managed cluster as loaded from the store in the given status */
    public static Cluster managedCluster(String id, LaunchConfig config, Cluster.Status status, Instant now) {
        return Cluster.restore(id, status, Cluster.Kind.SCHEDULER, true, null, credentials(), config,
                List.of(), null, Map.of(), now, now);
    }

    public static Cluster userCluster(String id, String owner, LaunchConfig config, Cluster.Status status,
                                      Instant terminateOn, Instant now) {
        return Cluster.restore(id, status, Cluster.Kind.USER, false, owner, credentials(), config,
                List.of(), terminateOn, Map.of(), now, now);
    }
}
