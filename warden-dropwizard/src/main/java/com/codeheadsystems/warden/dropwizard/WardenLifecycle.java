package com.codeheadsystems.warden.dropwizard;

import com.codeheadsystems.warden.server.manager.AttestationManager;
import com.codeheadsystems.warden.server.store.Stores;
import io.dropwizard.lifecycle.Managed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops the attestation manager's threads and releases the storage connection on shutdown.
 */
public class WardenLifecycle implements Managed {

  private static final Logger log = LoggerFactory.getLogger(WardenLifecycle.class);

  private final AttestationManager attestationManager;
  private final Stores stores;

  public WardenLifecycle(AttestationManager attestationManager, Stores stores) {
    this.attestationManager = attestationManager;
    this.stores = stores;
  }

  @Override
  public void start() {
    log.info("Attestation started (enabled={}, backend={})", attestationManager.isEnabled(), stores.backend());
  }

  @Override
  public void stop() {
    log.info("Stopping attestation");
    attestationManager.shutdown();
    stores.close();
  }
}
