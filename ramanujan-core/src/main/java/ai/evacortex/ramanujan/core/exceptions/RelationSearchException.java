/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.exceptions;

public class RelationSearchException extends RuntimeException {
    public RelationSearchException(String message) {
        super("Integer relation search failed: " + message);
    }

    public RelationSearchException(String message, Throwable cause) {
        super("Integer relation search failed: " + message, cause);
    }
}
