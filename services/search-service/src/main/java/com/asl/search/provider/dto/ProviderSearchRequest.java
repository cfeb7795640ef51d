package com.asl.search.provider.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProviderSearchRequest {
    private String query;
    private int numResults;
    private List<String> types;
    private String tbs;
    private String filter;
    private String lang;
    private String country;
    private String location;

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public int getNumResults() {
        return numResults;
    }

    public void setNumResults(int numResults) {
        this.numResults = numResults;
    }

    public List<String> getTypes() {
        return types;
    }

    public void setTypes(List<String> types) {
        this.types = types;
    }

    public String getTbs() {
        return tbs;
    }

    public void setTbs(String tbs) {
        this.tbs = tbs;
    }

    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }

    public String getLang() {
        return lang;
    }

    public void setLang(String lang) {
        this.lang = lang;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public ProviderSearchRequest forQuery(String variant) {
        ProviderSearchRequest copy = new ProviderSearchRequest();
        copy.setQuery(variant);
        copy.setNumResults(numResults);
        copy.setTypes(types);
        copy.setTbs(tbs);
        copy.setFilter(filter);
        copy.setLang(lang);
        copy.setCountry(country);
        copy.setLocation(location);
        return copy;
    }
}
