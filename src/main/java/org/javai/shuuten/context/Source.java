package org.javai.shuuten.context;

/**
 * The kind of host an invocation runs on.
 */
public enum Source {
    /**
     * AWS Lambda function invocation.
     */
    LAMBDA,

    /**
     * ECS (or Fargate) task.
     */
    ECS,

    /**
     * Anything else: a local run, a plain JVM job, an unrecognised platform.
     */
    GENERIC
}
