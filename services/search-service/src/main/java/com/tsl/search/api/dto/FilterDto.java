package com.tsl.search.api.dto;

import com.tsl.search.model.StructuredFilter;
import java.util.ArrayList;
import java.util.List;

public class FilterDto {
    private String city;
    private String country;
    private List<String> activities;

    public static FilterDto from(StructuredFilter filter) {
        FilterDto dto = new FilterDto();
        if (filter == null) {
            dto.setActivities(List.of());
            return dto;
        }
        dto.setCity(filter.getCity());
        dto.setCountry(filter.getCountry());
        dto.setActivities(new ArrayList<>(filter.getActivities()));
        return dto;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public List<String> getActivities() {
        return activities;
    }

    public void setActivities(List<String> activities) {
        this.activities = activities;
    }
}
