package com.frogolio.frogol.repository;

import java.util.UUID;

public interface LinkClickCount {

    UUID getLinkId();

    Long getClicks();
}
