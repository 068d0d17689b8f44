package com.questrail.coverage.engine;

import com.questrail.coverage.model.RadioTechnology;

import java.util.Optional;

/**
 * Point query for the radio access technology the device is camped on.
 */
@FunctionalInterface
public interface RadioTechnologyService {

    Optional<RadioTechnology> currentTechnology();
}
