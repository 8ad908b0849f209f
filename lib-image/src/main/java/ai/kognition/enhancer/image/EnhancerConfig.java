/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.enhancer.image;

import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dempsy.util.Functional;

import ai.kognition.enhancer.image.calc.HistogramSampler;
import ai.kognition.enhancer.util.PropertiesUtils;

/**
 * Tunables for the engine and the session that hosts it.
 *
 * <p>
 * Values are resolved in layers, each overriding the one before it:
 * </p>
 * <ol>
 * <li>built in defaults</li>
 * <li>{@value #DEFAULTS_RESOURCE} on the classpath</li>
 * <li>the properties passed to {@link #load(Properties)}</li>
 * <li>the system property, or if it's not set the environment variable, for the key. e.g.
 * {@code -Denhancer.debounce.millis=50} or {@code ENHANCER_DEBOUNCE_MILLIS=50}</li>
 * </ol>
 * All keys carry the {@value #PREFIX} prefix.
 */
public class EnhancerConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnhancerConfig.class);

    public static final String PREFIX = "enhancer";
    public static final String DEFAULTS_RESOURCE = "enhancer.properties";

    public static final String HISTOGRAM_PIXEL_LIMIT = "histogram.pixelLimit";
    public static final String DEBOUNCE_MILLIS = "debounce.millis";
    public static final String OUTPUT_DIRECTORY = "output.directory";

    public static final long DEFAULT_DEBOUNCE_MILLIS = 100;
    public static final String DEFAULT_OUTPUT_DIRECTORY = "output";

    public final int histogramPixelLimit;
    public final long debounceMillis;
    public final String outputDirectory;

    private EnhancerConfig(final int histogramPixelLimit, final long debounceMillis, final String outputDirectory) {
        if(histogramPixelLimit < 1)
            throw new InvalidParameterException(PREFIX + "." + HISTOGRAM_PIXEL_LIMIT + " must be at least 1 but was " + histogramPixelLimit);
        if(debounceMillis < 0)
            throw new InvalidParameterException(PREFIX + "." + DEBOUNCE_MILLIS + " cannot be negative but was " + debounceMillis);
        if(outputDirectory == null || outputDirectory.trim().length() == 0)
            throw new InvalidParameterException(PREFIX + "." + OUTPUT_DIRECTORY + " cannot be empty");
        this.histogramPixelLimit = histogramPixelLimit;
        this.debounceMillis = debounceMillis;
        this.outputDirectory = outputDirectory;
    }

    public static EnhancerConfig defaults() {
        return new Builder().build();
    }

    public static EnhancerConfig load() {
        return load(new Properties());
    }

    public static EnhancerConfig load(final Properties overrides) {
        final Properties resolved = new Properties();
        if(Functional.uncheck(() -> PropertiesUtils.loadFromClasspath(resolved, DEFAULTS_RESOURCE)))
            LOGGER.debug("Loaded configuration defaults from {}", DEFAULTS_RESOURCE);
        if(overrides != null)
            resolved.putAll(overrides);

        final Properties section = PropertiesUtils.getSection(resolved, PREFIX, true);
        for(final String key: new String[] {HISTOGRAM_PIXEL_LIMIT,DEBOUNCE_MILLIS,OUTPUT_DIRECTORY}) {
            final String external = PropertiesUtils.systemOrEnv(PREFIX + "." + key);
            if(external != null)
                section.setProperty(key, external);
        }

        final Builder builder = new Builder();
        final String pixelLimit = section.getProperty(HISTOGRAM_PIXEL_LIMIT);
        if(pixelLimit != null)
            builder.histogramPixelLimit((int)parseLong(HISTOGRAM_PIXEL_LIMIT, pixelLimit, Integer.MAX_VALUE));
        final String debounce = section.getProperty(DEBOUNCE_MILLIS);
        if(debounce != null)
            builder.debounceMillis(parseLong(DEBOUNCE_MILLIS, debounce, Long.MAX_VALUE));
        final String outputDir = section.getProperty(OUTPUT_DIRECTORY);
        if(outputDir != null)
            builder.outputDirectory(outputDir.trim());

        final EnhancerConfig ret = builder.build();
        LOGGER.debug("Resolved configuration {}", ret);
        return ret;
    }

    private static long parseLong(final String key, final String value, final long max) {
        final long ret;
        try {
            ret = Long.parseLong(value.trim());
        } catch(final NumberFormatException nfe) {
            throw new InvalidParameterException(PREFIX + "." + key + " must be a whole number but was \"" + value + "\"", nfe);
        }
        if(ret > max)
            throw new InvalidParameterException(PREFIX + "." + key + " is too large: " + value);
        return ret;
    }

    public static class Builder {
        private int histogramPixelLimit = HistogramSampler.DEFAULT_PIXEL_LIMIT;
        private long debounceMillis = DEFAULT_DEBOUNCE_MILLIS;
        private String outputDirectory = DEFAULT_OUTPUT_DIRECTORY;

        public Builder histogramPixelLimit(final int histogramPixelLimit) {
            this.histogramPixelLimit = histogramPixelLimit;
            return this;
        }

        public Builder debounceMillis(final long debounceMillis) {
            this.debounceMillis = debounceMillis;
            return this;
        }

        public Builder outputDirectory(final String outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public EnhancerConfig build() {
            return new EnhancerConfig(histogramPixelLimit, debounceMillis, outputDirectory);
        }
    }

    @Override
    public String toString() {
        return "EnhancerConfig [histogramPixelLimit=" + histogramPixelLimit + ", debounceMillis=" + debounceMillis + ", outputDirectory="
            + outputDirectory + "]";
    }
}
