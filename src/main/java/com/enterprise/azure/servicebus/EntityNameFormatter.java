package com.enterprise.azure.servicebus;

import com.enterprise.azure.config.ServiceBusProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

/**
 * Derives physical Service Bus entity names from logical names.
 *
 * Naming scheme:
 *   queue        q.[master.]cleansed-name
 *   topic        t.[master.]cleansed-name
 *   subscription s.[master.]subscription-prefix.hash(cleansed-name)
 *
 * Every method is a pure function of its argument and the configured
 * prefixes, so the same logical name always maps to the same entity and
 * check-then-create never produces a second one.
 */
@Component
@RequiredArgsConstructor
public class EntityNameFormatter {

    /** Service Bus limit for subscription names. */
    public static final int MAX_SUBSCRIPTION_NAME_LENGTH = 50;

    // Entity segments can contain only letters, numbers, periods, hyphens and underscores
    private static final Pattern ILLEGAL_CHARACTERS = Pattern.compile("[^a-zA-Z0-9.\\-_]");

    private final ServiceBusProperties properties;

    public static String cleanse(String name) {
        return ILLEGAL_CHARACTERS.matcher(name).replaceAll("_");
    }

    public String queueName(String name) {
        return "q." + prefix() + cleanse(name);
    }

    public String topicName(String name) {
        return "t." + prefix() + cleanse(name);
    }

    /**
     * Subscription names are capped at 50 characters while logical names are
     * usually full type names, so the cleansed name is reduced to a hash.
     *
     * @throws EntityNameTooLongException if the prefixes alone push the name past the limit
     */
    public String subscriptionName(String name) {
        String subscriptionPrefix = properties.getSubscriptionNamePrefix() == null
                ? "" : properties.getSubscriptionNamePrefix();
        String subscriptionName = "s." + prefix() + subscriptionPrefix + "." + hash(cleanse(name));

        if (subscriptionName.length() > MAX_SUBSCRIPTION_NAME_LENGTH) {
            throw new EntityNameTooLongException(subscriptionName);
        }
        return subscriptionName;
    }

    private String prefix() {
        if (!StringUtils.hasLength(properties.getMasterPrefix())) {
            return "";
        }
        return properties.getMasterPrefix() + ".";
    }

    static String hash(String cleansedName) {
        return Integer.toHexString(cleansedName.hashCode());
    }

    /**
     * A derived entity name breaks a backend limit. Configuration problem,
     * never retried.
     */
    public static class EntityNameTooLongException extends IllegalArgumentException {
        public EntityNameTooLongException(String subscriptionName) {
            super("Resulting subscription name '" + subscriptionName + "' is longer than "
                    + MAX_SUBSCRIPTION_NAME_LENGTH + " character limit");
        }
    }
}
