/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.shell;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Typed access to the shell configuration.
 */
public final class Config
{
    private static final Configuration.Provider DEFAULT_PROVIDER = new DefaultConfiguration.Provider();
    private static Configuration.Provider provider = DEFAULT_PROVIDER;

    public static void setProvider(Configuration.Provider prov) {
        provider = prov != null ? prov : DEFAULT_PROVIDER;
    }

    public static final String CONFIG_RESOURCE = "lambda.properties";

    private final Configuration conf;

    public Config(String name) {
        conf = provider.load(name);
    }

    public static Config getDefault() {
        return new Config(CONFIG_RESOURCE);
    }

    public Optional<String> get(String name) {
        return conf.getProperty(name);
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public String toString() {
        return conf.toString();
    }

    public static final String PROMPT_KEY = "lambda.prompt";
    public static final String DEFAULT_PROMPT = "λ> ";
    public static final String HISTORY_FILE_KEY = "lambda.history.file";
    public static final String DEFAULT_HISTORY_FILE = ".lambda_history";

    public static Supplier<String> property(String key, String deflt) {
        return () -> getDefault().get(key, deflt);
    }

    /**
     * The prompt shown by the interactive shell.
     */
    public static final Supplier<String> PROMPT = property(PROMPT_KEY, DEFAULT_PROMPT);

    /**
     * The line editor history file. A relative path is resolved against the
     * user's home directory; an empty value disables the history file.
     */
    public static Optional<Path> historyFile() {
        String file = getDefault().get(HISTORY_FILE_KEY, DEFAULT_HISTORY_FILE).trim();
        if (file.isEmpty())
            return Optional.empty();
        return Optional.of(Paths.get(System.getProperty("user.home")).resolve(file));
    }
}
