package it.unimib.datai.fnship.aws;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.iam.IamAsyncClient;
import software.amazon.awssdk.services.iam.IamAsyncClientBuilder;
import software.amazon.awssdk.services.lambda.LambdaAsyncClient;
import software.amazon.awssdk.services.lambda.LambdaAsyncClientBuilder;

public final class AwsClients {

    private AwsClients() {}

    /** IAM is a global service; the region only applies when an endpoint override is set. */
    public static IamAsyncClient iam(AwsSettings settings) {
        IamAsyncClientBuilder builder = IamAsyncClient.builder()
                .credentialsProvider(credentials(settings));
        if (settings.endpointOverride() != null) {
            builder.region(Region.of(settings.region())).endpointOverride(settings.endpointOverride());
        } else {
            builder.region(Region.AWS_GLOBAL);
        }
        return builder.build();
    }

    public static LambdaAsyncClient lambda(AwsSettings settings) {
        LambdaAsyncClientBuilder builder = LambdaAsyncClient.builder()
                .region(Region.of(settings.region()))
                .credentialsProvider(credentials(settings));
        if (settings.endpointOverride() != null) {
            builder.endpointOverride(settings.endpointOverride());
        }
        return builder.build();
    }

    static AwsCredentialsProvider credentials(AwsSettings settings) {
        if (settings.profile() != null) {
            return ProfileCredentialsProvider.create(settings.profile());
        }
        return DefaultCredentialsProvider.create();
    }
}
