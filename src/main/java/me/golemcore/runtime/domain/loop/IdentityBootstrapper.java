package me.golemcore.runtime.domain.loop;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.FoldResult;
import me.golemcore.runtime.domain.model.Identity;
import me.golemcore.runtime.domain.reducer.Reducer;
import me.golemcore.runtime.port.outbound.IdentityPort;
import me.golemcore.runtime.port.outbound.TransportException;

/**
 * Performs the one-time identity handshake and builds the reducer's initial
 * state. A single attempt is made; any failure is fatal.
 */
@Slf4j
public class IdentityBootstrapper<S> {

    private final IdentityPort identityPort;
    private final Reducer<S> reducer;

    public IdentityBootstrapper(IdentityPort identityPort, Reducer<S> reducer) {
        this.identityPort = identityPort;
        this.reducer = reducer;
    }

    public BootstrapResult<S> bootstrap() throws BootstrapException {
        Identity identity;
        try {
            identity = identityPort.fetchIdentity();
        } catch (TransportException e) {
            throw new BootstrapException("Identity lookup failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new BootstrapException("Identity lookup returned an unusable response: " + e.getMessage(), e);
        }
        if (identity == null) {
            throw new BootstrapException("Identity lookup returned no account", null);
        }
        log.info("[Bootstrap] Acting as @{} (id {})", identity.username(), identity.id());

        FoldResult<S> initial;
        try {
            initial = reducer.init(identity);
        } catch (RuntimeException e) {
            throw new BootstrapException("Reducer initialisation failed: " + e.getMessage(), e);
        }
        if (initial == null) {
            throw new BootstrapException("Reducer initialisation returned no state", null);
        }
        return new BootstrapResult<>(identity, initial);
    }
}
