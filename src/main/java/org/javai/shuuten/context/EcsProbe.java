package org.javai.shuuten.context;

import org.javai.shuuten.Environment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recognises ECS tasks, either from a map envelope carrying a task ARN or from the
 * container metadata endpoint variables the ECS agent injects.
 *
 * <p>The metadata endpoint itself is not queried; task and cluster identifiers come from the
 * envelope or from {@code ECS_TASK_ARN} / {@code ECS_CLUSTER} when a deployment sets them.
 */
public final class EcsProbe implements ContextProbe {

    static final String METADATA_V4 = "ECS_CONTAINER_METADATA_URI_V4";
    static final String METADATA_V3 = "ECS_CONTAINER_METADATA_URI";

    @Override
    public Source source() {
        return Source.ECS;
    }

    @Override
    public Optional<Detection> probe(Object envelope, Environment environment) {
        String taskArn = null;
        String cluster = null;
        if (envelope instanceof Map<?, ?> map) {
            taskArn = ContextProbe.firstString(map, "taskArn", "task_arn", "TaskARN");
            cluster = ContextProbe.firstString(map, "cluster", "clusterArn", "Cluster");
        }
        boolean onEcs = environment.getNonBlank(METADATA_V4) != null || environment.getNonBlank(METADATA_V3) != null;
        if (taskArn == null && !onEcs) {
            return Optional.empty();
        }
        if (taskArn == null) {
            taskArn = environment.getNonBlank("ECS_TASK_ARN");
        }
        if (cluster == null) {
            cluster = environment.getNonBlank("ECS_CLUSTER");
        }

        Map<String, String> caller = new LinkedHashMap<>();
        if (taskArn != null) {
            caller.put(RuntimeContext.TASK_ARN, taskArn);
        }
        if (cluster != null) {
            caller.put(RuntimeContext.CLUSTER, cluster);
        }
        String region = ContextProbe.arnSegment(taskArn, 3);
        if (region != null) {
            caller.put(RuntimeContext.REGION, region);
        }
        String account = ContextProbe.arnSegment(taskArn, 4);
        if (account != null) {
            caller.put(RuntimeContext.ACCOUNT_ID, account);
        }
        return Optional.of(new Detection(taskId(taskArn), caller));
    }

    // arn:aws:ecs:region:account:task/cluster/taskId
    private static String taskId(String taskArn) {
        if (taskArn == null) {
            return null;
        }
        int slash = taskArn.lastIndexOf('/');
        return slash < 0 ? null : taskArn.substring(slash + 1);
    }
}
