package com.omrchecker.orchestrator.parsing.image;

/**
 * Makes a sheet image readable from the local filesystem. The caller must close the returned
 * {@link LocalImage}.
 */
public interface ImageFetcher {

    LocalImage fetch(String locator) throws ImageFetchException;
}
