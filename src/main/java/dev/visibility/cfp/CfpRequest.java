package dev.visibility.cfp;

/**
 * Input of one CFP run. With a {@code businessId} the stored business supplies
 * the URL when {@code url} is null, and the run writes its progress back to the store.
 */
public record CfpRequest(String url, Long businessId, CfpOptions options) {

    public CfpRequest {
        options = options == null ? CfpOptions.defaults() : options;
    }

    public static CfpRequest forUrl(String url) {
        return new CfpRequest(url, null, CfpOptions.defaults());
    }

    public static CfpRequest forUrl(String url, CfpOptions options) {
        return new CfpRequest(url, null, options);
    }

    public static CfpRequest forBusiness(Long businessId, CfpOptions options) {
        return new CfpRequest(null, businessId, options);
    }
}
