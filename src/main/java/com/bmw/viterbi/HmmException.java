/**
 * Copyright (C) 2016, BMW AG
 * Author: Stefan Holder (stefan.holder@bmw.de)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.bmw.viterbi;

/**
 * Base class of all errors reported by this library. Use {@link #kind()} to distinguish the
 * individual failure reasons.
 */
public class HmmException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public HmmException(ErrorKind kind, String message) {
        super(message);
        if (kind == null) {
            throw new NullPointerException("kind must not be null.");
        }
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

}
