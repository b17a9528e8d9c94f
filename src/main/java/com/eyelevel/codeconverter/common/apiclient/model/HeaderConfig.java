package com.eyelevel.codeconverter.common.apiclient.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Static headers sent with every request of one API client, such as a client identifier.
 */
@Getter
@Setter
public class HeaderConfig {

    private List<Header> headers = new ArrayList<>();

    /**
     * Adds a header and returns this configuration.
     */
    public HeaderConfig with(String name, String value) {
        headers.add(new Header(name, value));
        return this;
    }

    /**
     * Represents a single header with a name and a value.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Header {

        private String name;
        private String value;
    }
}
