/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.shell;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Properties;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;

import static java.util.Objects.requireNonNull;

/**
 * Properties loaded from a classpath resource. A system property with the
 * same name takes precedence over the resource.
 */
class DefaultConfiguration implements Configuration
{
    private final Properties properties;

    DefaultConfiguration(Properties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> getProperty(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(properties.getProperty(name));
    }

    public String toString() {
        return properties.toString();
    }

    static class ConfigurationLoader extends CacheLoader<String, DefaultConfiguration> {
        @Override
        public DefaultConfiguration load(String name) throws IOException {
            Properties properties = new Properties();
            try (InputStream in = DefaultConfiguration.class.getResourceAsStream("/" + name)) {
                // use defaults if the resource is missing
                if (in != null) {
                    Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
                    properties.load(reader);
                }
            }
            return new DefaultConfiguration(properties);
        }
    }

    @SuppressWarnings("ClassNameSameAsAncestorName")
    static class Provider implements Configuration.Provider {
        private final LoadingCache<String, DefaultConfiguration> cache =
            CacheBuilder.newBuilder().build(new ConfigurationLoader());

        @Override
        public Configuration load(String name) {
            return cache.getUnchecked(requireNonNull(name));
        }
    }
}
