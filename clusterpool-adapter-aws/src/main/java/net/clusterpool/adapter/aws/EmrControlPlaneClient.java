package net.clusterpool.adapter.aws;

import net.clusterpool.core.error.CancelException;
import net.clusterpool.core.error.CreateClusterException;
import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.error.UnableToAssignException;
import net.clusterpool.core.error.UnableToTerminateException;
import net.clusterpool.core.error.UpdateStatusException;
import net.clusterpool.core.model.LaunchConfig;
import net.clusterpool.core.spi.ControlPlaneClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.emr.EmrClient;
import software.amazon.awssdk.services.emr.model.AddJobFlowStepsRequest;
import software.amazon.awssdk.services.emr.model.CancelStepsInfo;
import software.amazon.awssdk.services.emr.model.CancelStepsRequest;
import software.amazon.awssdk.services.emr.model.CancelStepsResponse;
import software.amazon.awssdk.services.emr.model.DescribeClusterRequest;
import software.amazon.awssdk.services.emr.model.DescribeStepRequest;
import software.amazon.awssdk.services.emr.model.ListClustersRequest;
import software.amazon.awssdk.services.emr.model.RunJobFlowRequest;
import software.amazon.awssdk.services.emr.model.StepConfig;
import software.amazon.awssdk.services.emr.model.TerminateJobFlowsRequest;

import java.util.List;
import java.util.Map;

/** {@link ControlPlaneClient} over Amazon EMR: clusters are job flows, work units are steps. */
public final class EmrControlPlaneClient implements ControlPlaneClient {
    private static final Logger log = LoggerFactory.getLogger(EmrControlPlaneClient.class);

    private final EmrClient emr;

    public EmrControlPlaneClient(EmrClient emr) {
        this.emr = emr;
    }

    @Override
    public void checkCredentials() throws CredentialsException {
        try {
            emr.listClusters(ListClustersRequest.builder().build());
        } catch (SdkException e) {
            log.info("The control-plane credentials are either invalid or lack the necessary permissions");
            throw new CredentialsException(null, "The control-plane credentials provided are either invalid "
                    + "or do not have the necessary permissions - msg: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public String createCluster(LaunchConfig launchConfig) throws CreateClusterException {
        RunJobFlowRequest request;
        try {
            request = EmrRequests.runJobFlow(launchConfig.document());
        } catch (IllegalArgumentException e) {
            throw new CreateClusterException(null, "Error creating cluster - msg: invalid launch config: " + e.getMessage(), e);
        }
        try {
            return emr.runJobFlow(request).jobFlowId();
        } catch (SdkException e) {
            throw new CreateClusterException(null, "Error creating cluster - msg: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public String addWorkUnit(String clusterId, Map<String, Object> workSpec) throws UnableToAssignException {
        StepConfig step;
        try {
            step = EmrRequests.step(workSpec);
        } catch (IllegalArgumentException e) {
            throw new UnableToAssignException(clusterId, "Unable to add step " + workSpec.get("Name")
                    + " to cluster " + clusterId + " - msg: invalid work spec: " + e.getMessage(), e);
        }
        try {
            List<String> ids = emr.addJobFlowSteps(AddJobFlowStepsRequest.builder().jobFlowId(clusterId).steps(step).build()).stepIds();
            if (ids.isEmpty()) {
                throw new UnableToAssignException(clusterId, "Cluster " + clusterId + " returned no step id");
            }
            return ids.get(0);
        } catch (SdkException e) {
            throw new UnableToAssignException(clusterId, "Unable to add step " + step.name() + " to cluster "
                    + clusterId + " - msg: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public Map<String, Object> describeCluster(String clusterId) throws UpdateStatusException {
        try {
            return SnapshotMapper.toMap(emr.describeCluster(DescribeClusterRequest.builder().clusterId(clusterId).build()));
        } catch (SdkException e) {
            throw new UpdateStatusException(clusterId, "Error updating status for cluster " + clusterId
                    + " - msg: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public Map<String, Object> describeWorkUnit(String clusterId, String workId) throws UpdateStatusException {
        try {
            return SnapshotMapper.toMap(emr.describeStep(DescribeStepRequest.builder().clusterId(clusterId).stepId(workId).build()));
        } catch (SdkException e) {
            throw new UpdateStatusException(workId, "Error updating status for step " + workId
                    + " - msg: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public void terminateCluster(String clusterId) throws UnableToTerminateException {
        try {
            emr.terminateJobFlows(TerminateJobFlowsRequest.builder().jobFlowIds(clusterId).build());
        } catch (SdkException e) {
            throw new UnableToTerminateException(clusterId, "Error terminating cluster " + clusterId
                    + " - msg: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public void cancelWorkUnit(String clusterId, String workId) throws CancelException {
        CancelStepsResponse response;
        try {
            response = emr.cancelSteps(CancelStepsRequest.builder().clusterId(clusterId).stepIds(workId).build());
        } catch (SdkException e) {
            throw new CancelException(workId, "Error cancelling step " + workId + " in cluster " + clusterId
                    + " - msg: " + AwsErrors.describe(e), e);
        }
        for (CancelStepsInfo info : response.cancelStepsInfoList()) {
            if ("FAILED".equals(info.statusAsString())) {
                throw new CancelException(workId, "Error cancelling step " + workId + " in cluster " + clusterId
                        + " - msg: " + info.reason());
            }
        }
    }
}
