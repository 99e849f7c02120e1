package me.golemcore.dialogs.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Failure reported by the RPC transport. Either an error answered by the
 * server ({@code code} is the platform error code and the message its
 * constant name, such as {@code PEER_ID_INVALID}), or a local I/O failure with
 * code {@link #IO_ERROR_CODE}.
 */
public class RpcInvocationException extends Exception {
    private static final long serialVersionUID = 1L;

    public static final int IO_ERROR_CODE = -1;

    private final int code;

    public RpcInvocationException(int code, String message) {
        super(message);
        this.code = code;
    }

    public RpcInvocationException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isIoError() {
        return code == IO_ERROR_CODE;
    }
}
