package com.containerwatch.tracker.geo;

import com.containerwatch.tracker.model.Coordinates;

import java.util.Optional;

public interface Geocoder {

    /**
     * @return coordinates of the first match, or empty when the service knows no such place
     * @throws GeocodingException when the service could not be asked or answered garbage
     */
    Optional<Coordinates> geocode(String place, String country) throws GeocodingException;
}
