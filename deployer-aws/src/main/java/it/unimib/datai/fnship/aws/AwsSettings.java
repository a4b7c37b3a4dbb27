package it.unimib.datai.fnship.aws;

import java.net.URI;

/**
 * Connection settings for the AWS clients. {@code endpointOverride} points both clients at a
 * local emulator; {@code profile} selects a named credentials profile instead of the default chain.
 */
public record AwsSettings(String region, URI endpointOverride, String profile) {
    public static final String DEFAULT_REGION = "us-east-1";

    public AwsSettings {
        region = region == null || region.isBlank() ? DEFAULT_REGION : region;
        profile = profile == null || profile.isBlank() ? null : profile;
    }

    public static AwsSettings forRegion(String region) {
        return new AwsSettings(region, null, null);
    }
}
