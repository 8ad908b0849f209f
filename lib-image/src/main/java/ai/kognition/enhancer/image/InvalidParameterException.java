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

/**
 * A parameter was missing, non-numeric or out of range. Raised before any work is done.
 */
public class InvalidParameterException extends EnhancementException {
    private static final long serialVersionUID = 1L;

    public InvalidParameterException(final String msg) {
        super(msg);
    }

    public InvalidParameterException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
