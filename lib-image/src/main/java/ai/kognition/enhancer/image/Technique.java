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

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The enhancement applied to an image. Exactly one is active at a time.
 */
public enum Technique {
    IDENTITY("none", false),
    HISTOGRAM_EQUALIZATION("hist_eq", false),
    GAMMA_CORRECTION("gamma", true);

    /**
     * Short name used in output file names and in configuration.
     */
    public final String tag;
    private final boolean requiresGamma;

    private Technique(final String tag, final boolean requiresGamma) {
        this.tag = tag;
        this.requiresGamma = requiresGamma;
    }

    public boolean requiresGamma() {
        return requiresGamma;
    }

    public static Technique fromTag(final String tag) {
        if(tag != null) {
            for(final Technique t: values()) {
                if(t.tag.equalsIgnoreCase(tag.trim()) || t.name().equalsIgnoreCase(tag.trim()))
                    return t;
            }
        }
        throw new InvalidParameterException("Unknown enhancement technique \"" + tag + "\". Valid values are "
            + Arrays.stream(values()).map(t -> t.tag).collect(Collectors.joining(", ")));
    }
}
