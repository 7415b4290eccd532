package com.petition.archive;

import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the signature-archiver Micronaut application.
 *
 * This service runs the scheduled data-retention workflow of the signature
 * platform: records whose validation window has closed are copied from the
 * processing database into the permanent archive and then removed, and
 * validations that never matched a signature are reconciled as orphans.
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        log.info("Starting signature-archiver...");
        Micronaut.run(Application.class, args);
    }
}
