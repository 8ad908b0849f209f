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

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dempsy.util.QuietCloseable;

import ai.kognition.enhancer.image.GammaParameter;
import ai.kognition.enhancer.image.ImageDecodeException;
import ai.kognition.enhancer.image.ImageSource;
import ai.kognition.enhancer.image.InvalidParameterException;
import ai.kognition.enhancer.image.Technique;
import ai.kognition.enhancer.util.Debouncer;

/**
 * Connects an interactive parameter surface to an {@link EnhancementSession}.
 *
 * <p>
 * Gamma changes, which arrive in bursts while a slider is dragged, are debounced so only the
 * last value in a burst is applied once changes stop for the configured window. Technique
 * changes are applied right away. Either way the enhancement runs on a background thread,
 * at most one is pending, and the outcome goes to the result listener or, on failure, the
 * error handler.
 * </p>
 */
public class EnhancementControl implements QuietCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnhancementControl.class);

    public static final double DEFAULT_GAMMA = 1.0;

    private final EnhancementSession session;
    private final Consumer<EnhancementResult> listener;
    private final Consumer<RuntimeException> errorHandler;
    private final Debouncer debouncer;

    private Technique technique = Technique.IDENTITY;
    private double gamma = DEFAULT_GAMMA;

    public EnhancementControl(final EnhancementSession session, final Consumer<EnhancementResult> listener,
        final Consumer<RuntimeException> errorHandler) {
        this.session = session;
        this.listener = listener;
        this.errorHandler = errorHandler;
        this.debouncer = new Debouncer("enhancement-control", session.getConfig().debounceMillis);
    }

    /**
     * Load a new image, synchronously, resetting the technique to {@link Technique#IDENTITY}.
     * Any enhancement still waiting out the debounce window is dropped.
     */
    public EnhancementResult load(final ImageSource source, final String path) throws ImageDecodeException {
        synchronized(this) {
            debouncer.cancel();
            technique = Technique.IDENTITY;
        }
        final EnhancementResult result = session.load(source, path);
        listener.accept(result);
        return result;
    }

    /**
     * @throws InvalidParameterException right away if the gamma is out of range.
     */
    public synchronized void onGammaChanged(final double newGamma) {
        GammaParameter.of(newGamma);
        gamma = newGamma;
        if(technique.requiresGamma())
            debouncer.trigger(this::applyCurrent);
    }

    public synchronized void onTechniqueChanged(final Technique newTechnique) {
        if(newTechnique == null)
            throw new InvalidParameterException("No enhancement technique was selected.");
        technique = newTechnique;
        debouncer.triggerNow(this::applyCurrent);
    }

    public void reset() {
        onTechniqueChanged(Technique.IDENTITY);
    }

    public synchronized Technique getTechnique() {
        return technique;
    }

    public synchronized double getGamma() {
        return gamma;
    }

    public boolean isPending() {
        return debouncer.isPending();
    }

    private void applyCurrent() {
        final Technique t;
        final double g;
        synchronized(this) {
            t = technique;
            g = gamma;
        }
        try {
            session.apply(t, t.requiresGamma() ? g : null).ifPresent(listener);
        } catch(final RuntimeException rte) {
            LOGGER.warn("Failed to apply {} to the current image", t.tag, rte);
            errorHandler.accept(rte);
        }
    }

    @Override
    public void close() {
        debouncer.close();
    }
}
