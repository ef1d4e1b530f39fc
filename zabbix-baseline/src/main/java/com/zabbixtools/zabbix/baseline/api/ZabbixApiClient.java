/*
 * Copyright 2020 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.api;

import static com.zabbixtools.baseline.common.utils.Utils.validateNotNull;
import static com.zabbixtools.zabbix.baseline.ZabbixBaselineUtils.getRequiredConfig;
import static com.zabbixtools.zabbix.baseline.ZabbixBaselineUtils.isVersionAtLeast;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.zabbixtools.baseline.common.config.ConfigException;
import com.zabbixtools.baseline.common.config.types.Password;
import com.zabbixtools.zabbix.baseline.api.model.HistoryValue;
import com.zabbixtools.zabbix.baseline.api.model.HostElement;
import com.zabbixtools.zabbix.baseline.api.model.ItemElement;
import com.zabbixtools.zabbix.baseline.api.model.JsonRpcError;
import com.zabbixtools.zabbix.baseline.api.model.JsonRpcRequest;
import com.zabbixtools.zabbix.baseline.api.model.JsonRpcResponse;
import com.zabbixtools.zabbix.baseline.api.model.TemplateElement;
import com.zabbixtools.zabbix.baseline.api.query.HistoryQuery;
import com.zabbixtools.zabbix.baseline.api.query.HostQuery;
import com.zabbixtools.zabbix.baseline.api.query.ItemQuery;
import com.zabbixtools.zabbix.baseline.api.query.TemplateQuery;
import com.zabbixtools.zabbix.baseline.config.constants.ComparatorConfig;
import com.zabbixtools.zabbix.baseline.config.constants.ZabbixApiConfig;
import com.zabbixtools.zabbix.baseline.exception.ZabbixApiException;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class provides a client of the Zabbix JSON-RPC API.
 *
 * The session is opened with {@code apiinfo.version} followed by {@code user.login}. Servers before 5.4 expect the
 * login parameter {@code user}, later ones {@code username}. The session token goes in the {@code auth} member of
 * every request for servers before 6.4, and in an {@code Authorization: Bearer} header from 6.4 on.
 */
public class ZabbixApiClient implements ZabbixQueryCapability {
    private static final Logger LOG = LoggerFactory.getLogger(ZabbixApiClient.class);
    private static final Gson GSON = new Gson();
    static final ContentType JSON_RPC = ContentType.create("application/json-rpc", StandardCharsets.UTF_8);
    static final String VERSION_METHOD = "apiinfo.version";
    static final String LOGIN_METHOD = "user.login";
    static final String LOGOUT_METHOD = "user.logout";
    private static final String BEARER = "Bearer ";
    private static final Type TEMPLATES = new TypeToken<List<TemplateElement>>() { }.getType();
    private static final Type HOSTS = new TypeToken<List<HostElement>>() { }.getType();
    private static final Type ITEMS = new TypeToken<List<ItemElement>>() { }.getType();
    private static final Type HISTORY = new TypeToken<List<HistoryValue>>() { }.getType();

    private CloseableHttpClient _httpClient;
    private URI _endpoint;
    private String _username;
    private String _password;
    private final AtomicLong _requestId;
    private volatile String _serverVersion;
    private volatile String _token;
    private volatile boolean _bearerAuth;

    /**
     * Used when instantiated by reflection, {@link #configure(Map)} must follow.
     */
    public ZabbixApiClient() {
        _requestId = new AtomicLong(ThreadLocalRandom.current().nextLong(0, Integer.MAX_VALUE));
    }

    ZabbixApiClient(CloseableHttpClient httpClient, URI endpoint, String username, String password) {
        this();
        _httpClient = validateNotNull(httpClient, "httpClient cannot be null.");
        _endpoint = validateNotNull(endpoint, "endpoint cannot be null.");
        _username = validateNotNull(username, "username cannot be null.");
        _password = password == null ? "" : password;
    }

    @Override
    public void configure(Map<String, ?> configs) {
        String endpoint = getRequiredConfig(configs, ZabbixApiConfig.ZABBIX_API_URL_CONFIG);
        try {
            _endpoint = URI.create(endpoint);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(ZabbixApiConfig.ZABBIX_API_URL_CONFIG, endpoint, e.getMessage());
        }
        _username = getRequiredConfig(configs, ZabbixApiConfig.ZABBIX_API_USERNAME_CONFIG);
        Object password = configs.get(ZabbixApiConfig.ZABBIX_API_PASSWORD_CONFIG);
        if (password instanceof Password) {
            _password = ((Password) password).value();
        } else {
            _password = password == null ? "" : password.toString();
        }

        int timeoutMs = intConfig(configs, ZabbixApiConfig.ZABBIX_API_REQUEST_TIMEOUT_MS_CONFIG,
                                  ZabbixApiConfig.DEFAULT_ZABBIX_API_REQUEST_TIMEOUT_MS);
        int fetchThreads = intConfig(configs, ComparatorConfig.HISTORY_FETCH_THREADS_CONFIG,
                                     ComparatorConfig.DEFAULT_HISTORY_FETCH_THREADS);
        RequestConfig requestConfig = RequestConfig.custom()
                                                   .setConnectTimeout(timeoutMs)
                                                   .setSocketTimeout(timeoutMs)
                                                   .setConnectionRequestTimeout(timeoutMs)
                                                   .build();
        // One connection per concurrent history fetch plus the runner thread.
        int maxConnections = Math.max(2, fetchThreads + 1);
        _httpClient = HttpClients.custom()
                                 .setDefaultRequestConfig(requestConfig)
                                 .setMaxConnPerRoute(maxConnections)
                                 .setMaxConnTotal(maxConnections)
                                 .build();
    }

    private static int intConfig(Map<String, ?> configs, String name, int defaultValue) {
        Object value = configs.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(name, value, "Expected an integer.");
        }
    }

    @Override
    public void open() throws ZabbixApiException {
        _serverVersion = call(VERSION_METHOD, Collections.emptyList(), String.class, false);
        boolean usernameParam;
        try {
            usernameParam = isVersionAtLeast(_serverVersion, 5, 4);
            _bearerAuth = isVersionAtLeast(_serverVersion, 6, 4);
        } catch (IllegalArgumentException e) {
            throw new ZabbixApiException("Unexpected Zabbix API version " + _serverVersion, e);
        }
        Map<String, String> credentials = new LinkedHashMap<>();
        credentials.put(usernameParam ? "username" : "user", _username);
        credentials.put("password", _password);
        _token = call(LOGIN_METHOD, credentials, String.class, false);
        LOG.info("Logged in to Zabbix API {} version {} as {}.", _endpoint, _serverVersion, _username);
    }

    /**
     * @return The version reported by the server, {@code null} before {@link #open()}.
     */
    public String serverVersion() {
        return _serverVersion;
    }

    @Override
    public List<TemplateElement> queryTemplates(Map<String, List<String>> filter, Map<String, List<String>> search)
        throws ZabbixApiException {
        return call(TemplateQuery.METHOD, new TemplateQuery(filter, search), TEMPLATES, true);
    }

    @Override
    public List<HostElement> queryHosts(Collection<String> templateIds,
                                        Map<String, List<String>> filter,
                                        Map<String, List<String>> search) throws ZabbixApiException {
        return call(HostQuery.METHOD, new HostQuery(templateIds, filter, search), HOSTS, true);
    }

    @Override
    public List<ItemElement> queryItems(Collection<String> hostIds,
                                        Map<String, List<String>> filter,
                                        Map<String, List<String>> search) throws ZabbixApiException {
        return call(ItemQuery.METHOD, new ItemQuery(hostIds, filter, search), ITEMS, true);
    }

    @Override
    public List<HistoryValue> queryHistory(String itemId, int valueType, long fromEpochSeconds, long toEpochSeconds)
        throws ZabbixApiException {
        return call(HistoryQuery.METHOD, new HistoryQuery(itemId, valueType, fromEpochSeconds, toEpochSeconds), HISTORY, true);
    }

    <T> T call(String method, Object params, Type resultType, boolean authenticated) throws ZabbixApiException {
        if (authenticated && _token == null) {
            throw new ZabbixApiException(String.format("Cannot call %s before the session is open.", method));
        }
        long id = _requestId.incrementAndGet();
        JsonRpcRequest request = new JsonRpcRequest(method, params, id, authenticated && !_bearerAuth ? _token : null);
        HttpPost httpPost = new HttpPost(_endpoint);
        httpPost.setEntity(new StringEntity(GSON.toJson(request), JSON_RPC));
        if (authenticated && _bearerAuth) {
            httpPost.setHeader(HttpHeaders.AUTHORIZATION, BEARER + _token);
        }
        LOG.trace("Calling {} with id {}.", method, id);

        String responseString;
        int responseCode;
        try (CloseableHttpResponse response = _httpClient.execute(httpPost)) {
            responseCode = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                responseString = "";
            } else {
                InputStream content = entity.getContent();
                responseString = IOUtils.toString(content, StandardCharsets.UTF_8);
                EntityUtils.consume(entity);
            }
        } catch (IOException e) {
            throw new ZabbixApiException(String.format("Zabbix API call %s to %s failed.", method, _endpoint), e);
        }

        if (responseCode != HttpStatus.SC_OK) {
            throw new ZabbixApiException(String.format("Received non-success response code on Zabbix API call %s,"
                                                       + " response code = %d, response body = %s",
                                                       method, responseCode, responseString));
        }
        if (responseString.trim().isEmpty()) {
            throw new ZabbixApiException(String.format("No response received from Zabbix API call %s.", method));
        }
        try {
            JsonRpcResponse rpcResponse = GSON.fromJson(responseString, JsonRpcResponse.class);
            if (rpcResponse == null) {
                throw new ZabbixApiException(String.format(
                    "No response received from Zabbix API call %s, response body = %s", method, responseString));
            }
            JsonRpcError error = rpcResponse.error();
            if (error != null) {
                throw new ZabbixApiException(String.format("Zabbix API call %s failed with code %d: %s %s",
                                                           method, error.code(), error.message(), error.data()),
                                             error.code(), error.data());
            }
            JsonElement result = rpcResponse.result();
            if (result == null || result.isJsonNull()) {
                throw new ZabbixApiException(String.format(
                    "Response from Zabbix API call %s has no result, response body = %s", method, responseString));
            }
            if (rpcResponse.id() != null && rpcResponse.id() != id) {
                LOG.warn("Zabbix API call {} was answered with id {} instead of {}.", method, rpcResponse.id(), id);
            }
            return GSON.fromJson(result, resultType);
        } catch (JsonParseException e) {
            throw new ZabbixApiException(String.format(
                "Response from Zabbix API call %s is malformed, response body = %s", method, responseString), e);
        }
    }

    /**
     * Log out if a session is open, then release the HTTP client. A failed logout is only logged.
     */
    @Override
    public void close() throws IOException {
        if (_token != null) {
            try {
                Boolean loggedOut = call(LOGOUT_METHOD, Collections.emptyList(), Boolean.class, true);
                LOG.debug("Logged out of Zabbix API {}: {}.", _endpoint, loggedOut);
            } catch (ZabbixApiException e) {
                LOG.warn("Failed to log out of Zabbix API {}.", _endpoint, e);
            } finally {
                _token = null;
            }
        }
        if (_httpClient != null) {
            _httpClient.close();
        }
    }
}
