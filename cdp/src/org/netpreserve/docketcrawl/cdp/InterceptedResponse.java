package org.netpreserve.docketcrawl.cdp;

/**
 * A response observed by a window before the page consumed it. Redirect responses carry an empty body.
 *
 * @param url         the request URL
 * @param status      HTTP status code
 * @param contentType value of the Content-Type header or null
 * @param body        the response body
 */
public record InterceptedResponse(String url, int status, String contentType, byte[] body) {
    public boolean isRedirect() {
        return status >= 300 && status < 400;
    }

    @Override
    public String toString() {
        return "InterceptedResponse[" + status + " " + url + " " + contentType + " " + body.length + " bytes]";
    }
}
