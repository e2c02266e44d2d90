package com.flamingo.ai.deckindex.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;

/**
 * Documents in a SharePoint document library, read through the Microsoft Graph REST API with an
 * app-only (client credentials) token. The remote id is the drive item id, which survives renames
 * and moves.
 */
@Slf4j
public class GraphDriveDocumentSource implements RemoteDocumentSource {

  private static final String SCOPE = "https://graph.microsoft.com/.default";
  private static final Duration TOKEN_EXPIRY_MARGIN = Duration.ofMinutes(2);

  private final IngestionConfig.Source.Graph settings;
  private final List<String> allowedExtensions;
  private final WebClient webClient;
  private final Duration timeout;

  private String accessToken;
  private Instant tokenExpiresAt = Instant.EPOCH;
  private String driveId;

  public GraphDriveDocumentSource(
      IngestionConfig.Source.Graph settings, List<String> allowedExtensions) {
    this.settings = settings;
    this.allowedExtensions = List.copyOf(allowedExtensions);
    this.timeout = Duration.ofSeconds(settings.getTimeoutSeconds());
    this.webClient =
        WebClient.builder()
            .clientConnector(
                new ReactorClientHttpConnector(HttpClient.create().followRedirect(true)))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
            .build();
    log.info(
        "Graph document source initialized: site={}{}, library={}, folder='{}'",
        settings.getSiteHostname(),
        settings.getSitePath(),
        settings.getLibraryName(),
        settings.getFolderPath());
  }

  @Override
  public List<String> allowedExtensions() {
    return allowedExtensions;
  }

  @Override
  public List<SourceDocument> listDocuments() {
    String drive = resolveDriveId();
    List<SourceDocument> result = new ArrayList<>();
    Deque<URI> pending = new ArrayDeque<>();
    pending.push(encoded(folderChildrenUrl(drive)));
    while (!pending.isEmpty()) {
      URI url = pending.pop();
      while (url != null) {
        JsonNode page = getJson(url);
        for (JsonNode item : page.path("value")) {
          String name = item.path("name").asText();
          if (item.has("folder")) {
            pending.push(
                encoded(
                    settings.getBaseUrl()
                        + "/drives/"
                        + drive
                        + "/items/"
                        + item.path("id").asText()
                        + "/children"));
          } else if (item.has("file") && isSupportedFile(name)) {
            result.add(
                new SourceDocument(
                    item.path("id").asText(),
                    name,
                    parseInstant(item.path("lastModifiedDateTime").asText(null)),
                    item.path("size").asLong()));
          }
        }
        // nextLink is already encoded
        url =
            page.hasNonNull("@odata.nextLink")
                ? URI.create(page.path("@odata.nextLink").asText())
                : null;
      }
    }
    log.debug("Graph listed {} document(s)", result.size());
    return result;
  }

  @Override
  public void fetch(String remoteId, Path target) {
    URI url =
        encoded(
            settings.getBaseUrl()
                + "/drives/"
                + resolveDriveId()
                + "/items/"
                + remoteId
                + "/content");
    try {
      Flux<DataBuffer> body =
          webClient
              .get()
              .uri(url)
              .headers(h -> h.setBearerAuth(token()))
              .retrieve()
              .bodyToFlux(DataBuffer.class);
      DataBufferUtils.write(
              body,
              target,
              StandardOpenOption.CREATE,
              StandardOpenOption.TRUNCATE_EXISTING,
              StandardOpenOption.WRITE)
          .block(timeout);
    } catch (WebClientResponseException e) {
      throw translate("Download of " + remoteId, e);
    } catch (WebClientRequestException e) {
      throw new TransientStageException(
          "download", "Download of " + remoteId + " failed: " + e.getMessage(), e);
    } catch (IllegalStateException e) {
      // block() timeout
      throw new TransientStageException(
          "download", "Download of " + remoteId + " timed out: " + e.getMessage(), e);
    }
  }

  private synchronized String resolveDriveId() {
    if (driveId != null) {
      return driveId;
    }
    JsonNode site =
        getJson(
            encoded(
                settings.getBaseUrl()
                    + "/sites/"
                    + settings.getSiteHostname()
                    + ":"
                    + settings.getSitePath()));
    String siteId = site.path("id").asText();
    JsonNode drives = getJson(encoded(settings.getBaseUrl() + "/sites/" + siteId + "/drives"));
    for (JsonNode drive : drives.path("value")) {
      if (settings.getLibraryName().equals(drive.path("name").asText())) {
        driveId = drive.path("id").asText();
        log.info("Resolved document library '{}' to drive {}", settings.getLibraryName(), driveId);
        return driveId;
      }
    }
    throw new ContentProcessingException(
        "download", "Document library not found: " + settings.getLibraryName());
  }

  private String folderChildrenUrl(String drive) {
    String folder = settings.getFolderPath();
    if (folder == null || folder.isBlank() || "/".equals(folder)) {
      return settings.getBaseUrl() + "/drives/" + drive + "/root/children";
    }
    String trimmed = folder.startsWith("/") ? folder.substring(1) : folder;
    return settings.getBaseUrl() + "/drives/" + drive + "/root:/" + trimmed + ":/children";
  }

  private JsonNode getJson(URI url) {
    try {
      JsonNode node =
          webClient
              .get()
              .uri(url)
              .headers(h -> h.setBearerAuth(token()))
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .block(timeout);
      if (node == null) {
        throw new TransientStageException("download", "Empty Graph response from " + url);
      }
      return node;
    } catch (WebClientResponseException e) {
      throw translate("Graph request " + url, e);
    } catch (WebClientRequestException e) {
      throw new TransientStageException(
          "download", "Graph request " + url + " failed: " + e.getMessage(), e);
    }
  }

  private synchronized String token() {
    if (accessToken != null && Instant.now().isBefore(tokenExpiresAt)) {
      return accessToken;
    }
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("client_id", settings.getClientId());
    form.add("client_secret", settings.getClientSecret());
    form.add("scope", SCOPE);
    form.add("grant_type", "client_credentials");
    try {
      JsonNode response =
          webClient
              .post()
              .uri(
                  settings.getAuthorityUrl() + "/" + settings.getTenantId() + "/oauth2/v2.0/token")
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(BodyInserters.fromFormData(form))
              .retrieve()
              .bodyToMono(JsonNode.class)
              .block(timeout);
      if (response == null || !response.hasNonNull("access_token")) {
        throw new TransientStageException("download", "Token response carried no access token");
      }
      accessToken = response.path("access_token").asText();
      tokenExpiresAt =
          Instant.now()
              .plusSeconds(response.path("expires_in").asLong(3600))
              .minus(TOKEN_EXPIRY_MARGIN);
      log.debug("Acquired Graph access token, valid until {}", tokenExpiresAt);
      return accessToken;
    } catch (WebClientResponseException e) {
      throw new TransientStageException(
          "download", "Token request failed with HTTP " + e.getStatusCode().value(), e);
    } catch (WebClientRequestException e) {
      throw new TransientStageException(
          "download", "Token request failed: " + e.getMessage(), e);
    }
  }

  private RuntimeException translate(String operation, WebClientResponseException e) {
    if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
      return new ContentProcessingException("download", operation + " returned 404", e);
    }
    if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
      synchronized (this) {
        accessToken = null;
      }
    }
    return new TransientStageException(
        "download", operation + " failed with HTTP " + e.getStatusCode().value(), e);
  }

  private static URI encoded(String url) {
    return UriComponentsBuilder.fromUriString(url).build().encode().toUri();
  }

  private static Instant parseInstant(String value) {
    return value == null || value.isBlank() ? null : Instant.parse(value);
  }
}
