package com.tsl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tsl.search.model.StructuredFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class FieldsDto {
    private String city;
    private String country;
    private List<String> activities;

    @JsonProperty("price_tier")
    private String priceTier;

    private boolean partial;

    public static FieldsDto from(StructuredFields fields) {
        if (fields == null) {
            return null;
        }
        FieldsDto dto = new FieldsDto();
        dto.setCity(fields.getCity());
        dto.setCountry(fields.getCountry());
        dto.setActivities(new ArrayList<>(fields.getActivities()));
        dto.setPriceTier(fields.getPriceTier() == null ? null : fields.getPriceTier().name().toLowerCase(Locale.ROOT));
        dto.setPartial(fields.isPartial());
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

    public String getPriceTier() {
        return priceTier;
    }

    public void setPriceTier(String priceTier) {
        this.priceTier = priceTier;
    }

    public boolean isPartial() {
        return partial;
    }

    public void setPartial(boolean partial) {
        this.partial = partial;
    }
}
