/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of VoxelFit.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.voxelfit;

import java.util.List;

/**
 * Base of the fitting error hierarchy.
 *
 * <p>Carries the model name and cascade chain at which the failure occurred, when known, so that reports name the
 * model, its position in the chain and the underlying cause.
 *
 * @author hal.hildebrand
 */
public class FittingException extends RuntimeException {

    private final String       modelName;
    private final List<String> chain;

    public FittingException(String message) {
        this(message, null, List.of(), null);
    }

    public FittingException(String message, Throwable cause) {
        this(message, null, List.of(), cause);
    }

    public FittingException(String message, String modelName, List<String> chain, Throwable cause) {
        super(message, cause);
        this.modelName = modelName;
        this.chain = chain == null ? List.of() : List.copyOf(chain);
    }

    /**
     * The model being fitted when the failure occurred, or null if not model specific.
     */
    public String getModelName() {
        return modelName;
    }

    /**
     * The cascade chain leading to the failing model; empty if unknown.
     */
    public List<String> getChain() {
        return chain;
    }

    /**
     * Zero based position of the failing model in its chain, or -1 if unknown.
     */
    public int getChainPosition() {
        return chain.isEmpty() ? -1 : chain.size() - 1;
    }

    @Override
    public String getMessage() {
        var message = super.getMessage();
        if (modelName == null) {
            return message;
        }
        var location = chain.isEmpty() ? modelName
                                       : String.format("%s (position %d in %s)", modelName, getChainPosition(),
                                                       chain);
        var cause = getCause() == null ? "" : ": " + getCause().getMessage();
        return String.format("[%s] %s%s", location, message, cause);
    }
}
