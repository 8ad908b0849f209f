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

package ai.kognition.enhancer.image.session;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.enhancer.image.GammaParameter;
import ai.kognition.enhancer.image.InvalidParameterException;
import ai.kognition.enhancer.image.Technique;

/**
 * Names of the files an enhanced image and its histogram are saved to:
 * {@code <basename>_<technique>[_<gamma>].png} and {@code <basename>_<technique>[_<gamma>]_hist.png}.
 */
public final class OutputNames {
    private static final Logger LOGGER = LoggerFactory.getLogger(OutputNames.class);

    public static final String IMAGE_EXTENSION = ".png";
    public static final String HISTOGRAM_SUFFIX = "_hist";

    public final String suffix;
    public final String imageFileName;
    public final String histogramFileName;

    private OutputNames(final String baseName, final String suffix) {
        this.suffix = suffix;
        this.imageFileName = baseName + "_" + suffix + IMAGE_EXTENSION;
        this.histogramFileName = baseName + "_" + suffix + HISTOGRAM_SUFFIX + IMAGE_EXTENSION;
    }

    /**
     * @param source the file the original image came from. Any directory and extension are dropped.
     *
     * @throws InvalidParameterException if there's no source name, the technique is
     *         {@link Technique#IDENTITY} (there's nothing to save), or gamma correction has no gamma.
     */
    public static OutputNames of(final String source, final Technique technique, final GammaParameter gamma) {
        if(source == null)
            throw new InvalidParameterException("There's no source image name to derive output file names from.");
        final String baseName = FilenameUtils.getBaseName(source);
        if(baseName.length() == 0)
            throw new InvalidParameterException("Cannot derive an output file name from \"" + source + "\"");
        if(technique == null || technique == Technique.IDENTITY)
            throw new InvalidParameterException("No enhancement applied. There's nothing to save.");
        if(technique.requiresGamma() && gamma == null)
            throw new InvalidParameterException("A gamma value is required to name " + technique.tag + " output.");

        return new OutputNames(baseName, technique.requiresGamma() ? technique.tag + "_" + gamma.format() : technique.tag);
    }

    public File imageFile(final File outputDirectory) {
        return new File(outputDirectory, imageFileName);
    }

    public File histogramFile(final File outputDirectory) {
        return new File(outputDirectory, histogramFileName);
    }

    /**
     * Create the output directory, and any missing parents, if it doesn't exist yet.
     */
    public static File prepareDirectory(final String outputDirectory) throws IOException {
        final File dir = new File(outputDirectory);
        if(!dir.isDirectory()) {
            FileUtils.forceMkdir(dir);
            LOGGER.info("Created output directory {}", dir.getAbsolutePath());
        }
        return dir;
    }

    @Override
    public String toString() {
        return "OutputNames [" + imageFileName + ", " + histogramFileName + "]";
    }
}
