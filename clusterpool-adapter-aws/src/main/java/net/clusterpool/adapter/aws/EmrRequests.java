package net.clusterpool.adapter.aws;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import software.amazon.awssdk.services.emr.model.RunJobFlowRequest;
import software.amazon.awssdk.services.emr.model.StepConfig;

import java.util.Map;

/**
 * Builds EMR requests from launch-config and work-spec documents written in the API's own
 * shape ({@code "Name"}, {@code "Instances"}, {@code "HadoopJarStep"} ...). Keys match case-insensitively;
 * an unknown key is an error.
 */
final class EmrRequests {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private EmrRequests() {}

    static RunJobFlowRequest runJobFlow(Map<String, Object> launchConfig) {
        return MAPPER.convertValue(launchConfig, RunJobFlowRequest.serializableBuilderClass()).build();
    }

    static StepConfig step(Map<String, Object> workSpec) {
        return MAPPER.convertValue(workSpec, StepConfig.serializableBuilderClass()).build();
    }
}
