/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.exceptions;

public class InvalidDomainException extends RuntimeException {
    public InvalidDomainException(String message) {
        super("Invalid coefficient domain: " + message);
    }

    public InvalidDomainException(String message, Throwable cause) {
        super("Invalid coefficient domain: " + message, cause);
    }
}
