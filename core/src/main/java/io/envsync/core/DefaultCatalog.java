// file: core/src/main/java/io/envsync/core/DefaultCatalog.java
package io.envsync.core;

import java.util.List;
import java.util.Map;

import static io.envsync.core.ResourceDescriptor.dependent;
import static io.envsync.core.ResourceDescriptor.independent;
import static io.envsync.core.ResourceDescriptor.singleton;

/**
 * Built-in catalog for Okta developer orgs, expressed in okta-cli-client
 * resource and command names.
 * <p>
 * Resource types that the CLI client cannot list yet (policies, schemas,
 * authenticators, log streams, ...) are left out. Policy rules and
 * authorization-server policy rules are left out too: their source types are
 * not first-pass resources, so they cannot be parameterized.
 * <p>
 * Each relation is backed up from one side only: memberships as user/listGroups
 * and group assignments as applicationGroups. The group-side lists hold the same
 * pairs and would attach every relation twice on restore.
 */
public final class DefaultCatalog {

    /** Parameter carrying a source id, keyed by source type. Anything else uses "id". */
    private static final Map<String, String> SOURCE_PARAMETERS = Map.of(
            "group", "groupId",
            "user", "userId",
            "application", "appId",
            "authorizationServer", "authServerId",
            "identityProvider", "idpId",
            "policy", "policyId"
    );

    private DefaultCatalog() {
        // static table
    }

    public static ResourceCatalog create() {
        return new ResourceCatalog(List.of(
                // --- singletons: org settings ---
                singleton("orgSetting", "gets"),
                singleton("orgSetting", "getOrgPreferences"),
                singleton("orgSetting", "getOktaCommunicationSettings"),
                singleton("orgSetting", "getOrgOktaSupportSettings"),
                singleton("orgSetting", "getThirdPartyAdminSetting"),
                singleton("orgSetting", "getWellknownOrgMetadata"),
                // security
                singleton("attackProtection", "getUserLockoutSettings"),
                singleton("attackProtection", "getAuthenticatorSettings"),
                singleton("threatInsight", "getCurrentConfiguration"),
                // rate limits
                singleton("rateLimitSettings", "getPerClient"),
                singleton("rateLimitSettings", "getWarningThreshold"),
                singleton("rateLimitSettings", "getAdminNotifications"),

                // --- first pass ---
                independent("user", "lists"),
                independent("group", "lists"),
                independent("userType", "lists"),
                independent("application", "lists"),
                independent("authorizationServer", "lists"),
                independent("identityProvider", "lists"),
                independent("networkZone", "lists"),
                independent("trustedOrigin", "lists"),
                independent("apiToken", "lists"),
                independent("customDomain", "lists"),
                independent("customization", "listBrands"),
                independent("eventHook", "lists"),
                independent("inlineHook", "lists"),
                independent("hookKey", "lists"),
                independent("role", "lists"),
                independent("feature", "lists"),
                independent("emailDomain", "lists"),
                independent("template", "listSmss"),

                // --- second pass: users ---
                dependentOn("user", "listAppLinks", "user"),
                dependentOn("user", "listGroups", "user"),
                dependentOn("user", "listGrants", "user"),
                dependentOn("user", "listIdentityProviders", "user"),
                dependentOn("userFactor", "listFactors", "user"),
                dependentOn("roleAssignment", "listAssignedRolesForUser", "user"),
                // applications
                dependentOn("applicationGroups", "listApplicationGroupAssignments", "application"),
                // authorization servers
                dependentOn("authorizationServerClaims", "listOAuth2Claims", "authorizationServer"),
                dependentOn("authorizationServerScopes", "listOAuth2Scopes", "authorizationServer"),
                dependentOn("authorizationServerPolicies", "list", "authorizationServer"),
                dependentOn("authorizationServerClients", "listOAuth2ClientsForAuthorizationServer",
                        "authorizationServer"),
                // identity providers
                dependentOn("identityProvider", "listKeys", "identityProvider"),
                dependentOn("identityProvider", "listSigningKeys", "identityProvider")
        ));
    }

    /** Parameter name that carries an id of the given source type. */
    public static String parameterFor(String sourceType) {
        return SOURCE_PARAMETERS.getOrDefault(sourceType, "id");
    }

    private static ResourceDescriptor dependentOn(String name, String listCommand, String sourceType) {
        return dependent(name, listCommand, sourceType, parameterFor(sourceType));
    }
}
