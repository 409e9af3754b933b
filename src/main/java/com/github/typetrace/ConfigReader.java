package com.github.typetrace;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import com.github.typetrace.parser.TypeVariables;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ConfigReader {

    static final String RESOURCE = "type-tracer.properties";

    public static Config readConfig() {
        return readConfig(RESOURCE);
    }

    static Config readConfig(String resource) {
        var config = new Config();
        Properties properties = new Properties();
        try (InputStream in = ConfigReader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("{} not found on the classpath, using defaults", resource);
                return config;
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + resource, e);
        }

        config.strictLexing = Boolean.parseBoolean(properties.getProperty("lexer.strict", "false").trim());
        config.placeholder = properties.getProperty("trace.placeholder", TypeVariables.DEFAULT_PLACEHOLDER);
        return config;
    }

    public static class Config {
        boolean strictLexing = false;
        String placeholder = TypeVariables.DEFAULT_PLACEHOLDER;

        public void applyConfig(ConfigTarget ct) {
            ct.setStrictLexing(strictLexing);
            ct.setPlaceholder(placeholder);
        }
    }

    public interface ConfigTarget {
        void setStrictLexing(boolean strictLexing);
        void setPlaceholder(String placeholder);
    }

}
