package net.clusterpool.adapter.aws;

import net.clusterpool.core.error.CancelException;
import net.clusterpool.core.error.CreateClusterException;
import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.error.UpdateStatusException;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.model.RemoteSnapshot;
import net.clusterpool.core.status.CredentialExpiry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.emr.EmrClient;
import software.amazon.awssdk.services.emr.model.AddJobFlowStepsRequest;
import software.amazon.awssdk.services.emr.model.AddJobFlowStepsResponse;
import software.amazon.awssdk.services.emr.model.CancelStepsInfo;
import software.amazon.awssdk.services.emr.model.CancelStepsRequest;
import software.amazon.awssdk.services.emr.model.CancelStepsResponse;
import software.amazon.awssdk.services.emr.model.CancelStepsRequestStatus;
import software.amazon.awssdk.services.emr.model.Cluster;
import software.amazon.awssdk.services.emr.model.ClusterState;
import software.amazon.awssdk.services.emr.model.ClusterStatus;
import software.amazon.awssdk.services.emr.model.ClusterTimeline;
import software.amazon.awssdk.services.emr.model.DescribeClusterRequest;
import software.amazon.awssdk.services.emr.model.DescribeClusterResponse;
import software.amazon.awssdk.services.emr.model.DescribeStepRequest;
import software.amazon.awssdk.services.emr.model.DescribeStepResponse;
import software.amazon.awssdk.services.emr.model.EmrException;
import software.amazon.awssdk.services.emr.model.ListClustersRequest;
import software.amazon.awssdk.services.emr.model.RunJobFlowRequest;
import software.amazon.awssdk.services.emr.model.RunJobFlowResponse;
import software.amazon.awssdk.services.emr.model.Step;
import software.amazon.awssdk.services.emr.model.StepState;
import software.amazon.awssdk.services.emr.model.StepStatus;
import software.amazon.awssdk.services.emr.model.StepTimeline;
import software.amazon.awssdk.services.emr.model.Tag;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmrControlPlaneClientTest {

    @Mock
    EmrClient emr;

    static Map<String, Object> jobFlow() {
        Map<String, Object> volume = new LinkedHashMap<>();
        volume.put("VolumeType", "gp2");
        volume.put("SizeInGB", 64);
        Map<String, Object> master = new LinkedHashMap<>();
        master.put("InstanceRole", "MASTER");
        master.put("InstanceType", "m5.xlarge");
        master.put("InstanceCount", 1);
        master.put("EbsConfiguration", Map.of("EbsBlockDeviceConfigs",
                List.of(Map.of("VolumeSpecification", volume, "VolumesPerInstance", 1))));
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("Name", "etl");
        doc.put("ReleaseLabel", "emr-6.15.0");
        doc.put("LogUri", "s3://logs.example/emr");
        doc.put("Instances", Map.of("InstanceGroups", List.of(master), "KeepJobFlowAliveWhenNoSteps", true));
        doc.put("BootstrapActions", List.of(Map.of("Name", "install-deps",
                "ScriptBootstrapAction", Map.of("Path", "s3://scripts.example/bootstrap.sh"))));
        return doc;
    }

    static EmrException serviceError(String code, String message) {
        return (EmrException) EmrException.builder()
                .statusCode(400)
                .message(message)
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(message).build())
                .build();
    }

    @Test
    void launch_config_document_becomes_a_run_job_flow_request() throws Exception {
        when(emr.runJobFlow(any(RunJobFlowRequest.class)))
                .thenReturn(RunJobFlowResponse.builder().jobFlowId("j-ABC").build());

        String id = new EmrControlPlaneClient(emr).createCluster(LaunchConfig.of(jobFlow()));

        assertEquals("j-ABC", id);
        ArgumentCaptor<RunJobFlowRequest> sent = ArgumentCaptor.forClass(RunJobFlowRequest.class);
        verify(emr).runJobFlow(sent.capture());
        RunJobFlowRequest r = sent.getValue();
        assertEquals("etl", r.name());
        assertEquals("emr-6.15.0", r.releaseLabel());
        assertTrue(r.instances().keepJobFlowAliveWhenNoSteps());
        assertEquals("m5.xlarge", r.instances().instanceGroups().get(0).instanceType());
        assertEquals(64, r.instances().instanceGroups().get(0).ebsConfiguration()
                .ebsBlockDeviceConfigs().get(0).volumeSpecification().sizeInGB());
        assertEquals("s3://scripts.example/bootstrap.sh", r.bootstrapActions().get(0).scriptBootstrapAction().path());
    }

    @Test
    void unknown_launch_config_key_fails_without_a_remote_call() {
        Map<String, Object> doc = jobFlow();
        doc.put("NoSuchSetting", "x");

        assertThrows(CreateClusterException.class,
                () -> new EmrControlPlaneClient(emr).createCluster(LaunchConfig.of(doc)));
        verifyNoInteractions(emr);
    }

    @Test
    void service_errors_carry_the_error_code() {
        when(emr.runJobFlow(any(RunJobFlowRequest.class)))
                .thenThrow(serviceError("ExpiredTokenException", "The security token included in the request is expired"));

        CreateClusterException e = assertThrows(CreateClusterException.class,
                () -> new EmrControlPlaneClient(emr).createCluster(LaunchConfig.of(jobFlow())));

        assertThat(e.getMessage()).startsWith("Error creating cluster - msg: ExpiredTokenException");
        assertTrue(CredentialExpiry.indicatedBy(e));
    }

    @Test
    void work_spec_becomes_a_step() throws Exception {
        when(emr.addJobFlowSteps(any(AddJobFlowStepsRequest.class)))
                .thenReturn(AddJobFlowStepsResponse.builder().stepIds("s-1").build());
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("Name", "daily");
        spec.put("ActionOnFailure", "CONTINUE");
        spec.put("HadoopJarStep", Map.of("Jar", "command-runner.jar", "Args", List.of("spark-submit", "job.py")));

        String stepId = new EmrControlPlaneClient(emr).addWorkUnit("j-ABC", spec);

        assertEquals("s-1", stepId);
        ArgumentCaptor<AddJobFlowStepsRequest> sent = ArgumentCaptor.forClass(AddJobFlowStepsRequest.class);
        verify(emr).addJobFlowSteps(sent.capture());
        assertEquals("j-ABC", sent.getValue().jobFlowId());
        assertEquals("daily", sent.getValue().steps().get(0).name());
        assertEquals(List.of("spark-submit", "job.py"), sent.getValue().steps().get(0).hadoopJarStep().args());
    }

    @Test
    void describe_cluster_keeps_the_api_shape() throws Exception {
        when(emr.describeCluster(any(DescribeClusterRequest.class))).thenReturn(DescribeClusterResponse.builder()
                .cluster(Cluster.builder()
                        .id("j-ABC")
                        .name("etl")
                        .logUri("s3://logs.example/emr")
                        .masterPublicDnsName("ip-10-63-57-26.ec2.internal")
                        .status(ClusterStatus.builder()
                                .state(ClusterState.WAITING)
                                .timeline(ClusterTimeline.builder()
                                        .creationDateTime(Instant.parse("2024-01-31T09:00:00Z"))
                                        .build())
                                .build())
                        .tags(Tag.builder().key("team").value("data").build())
                        .build())
                .build());

        Map<String, Object> payload = new EmrControlPlaneClient(emr).describeCluster("j-ABC");

        RemoteSnapshot s = RemoteSnapshot.of(payload);
        assertEquals("WAITING", s.text("Cluster", "Status", "State"));
        assertEquals("2024-01-31T09:00:00Z", s.text("Cluster", "Status", "Timeline", "CreationDateTime"));
        assertEquals("ip-10-63-57-26.ec2.internal", s.text("Cluster", "MasterPublicDnsName"));
        assertEquals(List.of(Map.of("Key", "team", "Value", "data")), s.list("Cluster", "Tags"));
    }

    @Test
    void describe_step_keeps_the_api_shape() throws Exception {
        when(emr.describeStep(any(DescribeStepRequest.class))).thenReturn(DescribeStepResponse.builder()
                .step(Step.builder()
                        .id("s-1")
                        .name("daily")
                        .status(StepStatus.builder()
                                .state(StepState.COMPLETED)
                                .timeline(StepTimeline.builder()
                                        .startDateTime(Instant.parse("2024-01-31T09:05:00Z"))
                                        .build())
                                .build())
                        .build())
                .build());

        RemoteSnapshot s = RemoteSnapshot.of(new EmrControlPlaneClient(emr).describeWorkUnit("j-ABC", "s-1"));

        assertEquals("COMPLETED", s.text("Step", "Status", "State"));
        assertEquals("2024-01-31T09:05:00Z", s.text("Step", "Status", "Timeline", "StartDateTime"));
    }

    @Test
    void describe_failure_is_an_update_status_error() {
        when(emr.describeCluster(any(DescribeClusterRequest.class)))
                .thenThrow(serviceError("ThrottlingException", "Rate exceeded"));

        UpdateStatusException e = assertThrows(UpdateStatusException.class,
                () -> new EmrControlPlaneClient(emr).describeCluster("j-ABC"));
        assertEquals("j-ABC", e.entityId());
    }

    @Test
    void refused_cancel_is_reported() {
        when(emr.cancelSteps(any(CancelStepsRequest.class))).thenReturn(CancelStepsResponse.builder()
                .cancelStepsInfoList(CancelStepsInfo.builder()
                        .stepId("s-1")
                        .status(CancelStepsRequestStatus.FAILED)
                        .reason("step already finished")
                        .build())
                .build());

        CancelException e = assertThrows(CancelException.class,
                () -> new EmrControlPlaneClient(emr).cancelWorkUnit("j-ABC", "s-1"));
        assertThat(e.getMessage()).contains("step already finished");
    }

    @Test
    void rejected_credentials_are_a_credentials_error() {
        when(emr.listClusters(any(ListClustersRequest.class)))
                .thenThrow(serviceError("InvalidClientTokenId", "The security token included in the request is invalid"));

        CredentialsException e = assertThrows(CredentialsException.class,
                () -> new EmrControlPlaneClient(emr).checkCredentials());
        assertTrue(CredentialExpiry.indicatedBy(e));
    }
}
