package org.javai.shuuten.context;

import com.amazonaws.services.lambda.runtime.ClientContext;
import com.amazonaws.services.lambda.runtime.CognitoIdentity;
import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;

/**
 * A Lambda {@link Context} with fixed values.
 */
public class FakeLambdaContext implements Context {

    public static final String REQUEST_ID = "c6af9ac6-7b61-11e6-9a41-93e812345678";
    public static final String FUNCTION_NAME = "nightly-billing";
    public static final String FUNCTION_ARN = "arn:aws:lambda:eu-west-1:123456789012:function:nightly-billing";
    public static final String LOG_GROUP = "/aws/lambda/nightly-billing";
    public static final String LOG_STREAM = "2026/10/18/[$LATEST]abcdef";

    @Override
    public String getAwsRequestId() {
        return REQUEST_ID;
    }

    @Override
    public String getLogGroupName() {
        return LOG_GROUP;
    }

    @Override
    public String getLogStreamName() {
        return LOG_STREAM;
    }

    @Override
    public String getFunctionName() {
        return FUNCTION_NAME;
    }

    @Override
    public String getFunctionVersion() {
        return "$LATEST";
    }

    @Override
    public String getInvokedFunctionArn() {
        return FUNCTION_ARN;
    }

    @Override
    public CognitoIdentity getIdentity() {
        return null;
    }

    @Override
    public ClientContext getClientContext() {
        return null;
    }

    @Override
    public int getRemainingTimeInMillis() {
        return 30_000;
    }

    @Override
    public int getMemoryLimitInMB() {
        return 512;
    }

    @Override
    public LambdaLogger getLogger() {
        return null;
    }
}
