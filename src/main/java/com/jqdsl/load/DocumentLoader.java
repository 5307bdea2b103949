package com.jqdsl.load;

import com.jqdsl.json.DocumentParser;
import com.jqdsl.json.JsonNode;
import com.jqdsl.query.Queryable;
import com.jqdsl.tree.TreeBuilder;
import com.jqdsl.tree.UnsupportedShapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads JSON and YAML documents from files, directory trees and http(s) URLs into one
 * {@link Queryable}. Each document becomes a tree whose source is the path it came from. Documents
 * that fail to parse, or whose top level is a scalar, are skipped.
 */
public class DocumentLoader {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentLoader.class);

    public static final String DEFAULT_IGNORE = ".*(log|txt)$";

    private final DocumentParser parser = new DocumentParser();
    private final Pattern ignore;
    private final String rootName;
    private HttpClient client;

    public DocumentLoader() {
        this(DEFAULT_IGNORE, TreeBuilder.ROOT_NAME);
    }

    // A null or empty ignore pattern skips nothing.
    public DocumentLoader(String ignore, String rootName) {
        this.ignore = ignore == null || ignore.isEmpty() ? null : Pattern.compile(ignore);
        this.rootName = rootName;
    }

    public Queryable analyze(List<String> paths) {
        Queryable result = Queryable.empty();
        int loaded = 0;
        for (String path : paths) {
            for (String document : expand(path)) {
                Queryable tree = load(document);
                if (tree.notEmpty()) {
                    result.extend(tree);
                    loaded++;
                }
            }
        }
        LOG.info("Loaded {} documents", loaded);
        return result;
    }

    public Queryable load(String path) {
        if (ignore != null && ignore.matcher(path).find()) {
            LOG.debug("Ignoring {}", path);
            return Queryable.empty();
        }
        try {
            JsonNode document = parser.parse(read(path), DocumentParser.Format.forPath(path));
            if (!(document instanceof JsonNode.JsonObject) && !(document instanceof JsonNode.JsonArray)) {
                LOG.debug("Skipping {}: top level is a scalar", path);
                return Queryable.empty();
            }
            return Queryable.of(TreeBuilder.build(document, rootName, path));
        } catch (IOException | UnsupportedShapeException e) {
            LOG.warn("Skipping {}: {}", path, e.getMessage());
            return Queryable.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while fetching {}", path);
            return Queryable.empty();
        }
    }

    private List<String> expand(String path) {
        if (isUrl(path)) {
            return List.of(path);
        }
        Path start = Paths.get(path);
        if (!Files.isDirectory(start, LinkOption.NOFOLLOW_LINKS)) {
            return List.of(path);
        }
        try (Stream<Path> walk = Files.walk(start)) {
            return walk.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .map(Path::toString)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Cannot list {}: {}", path, e.getMessage());
            return List.of();
        }
    }

    private byte[] read(String path) throws IOException, InterruptedException {
        if (!isUrl(path)) {
            try (InputStream in = Files.newInputStream(Paths.get(path))) {
                return in.readAllBytes();
            }
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(path))
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        HttpResponse<byte[]> response = client().send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode());
        }
        return response.body();
    }

    private HttpClient client() {
        if (client == null) {
            client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(10))
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build();
        }
        return client;
    }

    private static boolean isUrl(String path) {
        return path.startsWith("http://") || path.startsWith("https://");
    }
}
