package com.asl.search.provider;

import com.asl.search.provider.dto.ProviderSearchRequest;
import com.asl.search.provider.dto.ProviderSearchResponse;

public interface SearchProvider {
    ProviderSearchResponse search(ProviderSearchRequest request);
}
