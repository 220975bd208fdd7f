package org.dpg.jobprocessor.common.apiclient.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Static headers sent with every call of one client, e.g. the preservation registry's user header.
 */
@Getter
@Setter
public class HeaderConfig {

    private List<Header> headers = new ArrayList<>();

    public static HeaderConfig of(String name, String value) {
        HeaderConfig config = new HeaderConfig();
        config.getHeaders().add(new Header(name, value));
        return config;
    }

    public static HeaderConfig none() {
        return new HeaderConfig();
    }

    @Getter
    @Setter
    public static class Header {

        private String name;
        private String value;

        public Header(String name, String value) {
            this.name = name;
            this.value = value;
        }
    }
}
