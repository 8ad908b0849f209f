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

package ai.kognition.enhancer.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    /**
     * The entries under {@code section}, meaning every key of the form {@code section.rest}.
     * With {@code stripPrefix} the returned keys are just {@code rest}. Without it the keys
     * are returned as is and a bare {@code section} key is included too.
     */
    public static Properties getSection(final Properties props, final String section, final boolean stripPrefix) {
        final String prefix = section + ".";
        final Properties ret = new Properties();
        props.stringPropertyNames().stream()
            .filter(name -> name.startsWith(prefix) || (!stripPrefix && name.equals(section)))
            .forEach(name -> ret.setProperty(stripPrefix ? name.substring(prefix.length()) : name, props.getProperty(name)));
        return ret;
    }

    /**
     * Load the properties from the given classpath resource into {@code p}. A missing
     * resource is not an error and leaves {@code p} untouched.
     *
     * @return whether or not the resource was found.
     */
    public static boolean loadFromClasspath(final Properties p, final String resource) throws IOException {
        final ClassLoader cl = Thread.currentThread().getContextClassLoader() == null ? PropertiesUtils.class.getClassLoader()
            : Thread.currentThread().getContextClassLoader();

        try(InputStream is = cl.getResourceAsStream(resource);) {
            if(is == null) {
                LOGGER.debug("No properties resource \"{}\" on the classpath", resource);
                return false;
            }
            p.load(is);
        }
        return true;
    }

    /**
     * Look up {@code key} first as a system property and then, if the system property isn't
     * set at all, as an environment variable named by upper casing the key and replacing
     * every '.' with '_'. So "enhancer.debounce.millis" can also be supplied as
     * ENHANCER_DEBOUNCE_MILLIS.
     */
    public static String systemOrEnv(final String key) {
        final String sysProp = System.getProperty(key);
        if(sysProp != null)
            return sysProp;
        return System.getenv(envName(key));
    }

    public static String envName(final String key) {
        return key.toUpperCase().replace('.', '_');
    }
}
