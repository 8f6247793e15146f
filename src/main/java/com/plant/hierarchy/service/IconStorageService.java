package com.plant.hierarchy.service;

import com.plant.hierarchy.config.HierarchyProperties;
import com.plant.hierarchy.dto.IconInfo;
import com.plant.hierarchy.exception.IconNotFoundException;
import com.plant.hierarchy.exception.IconStorageException;
import com.plant.hierarchy.exception.IconValidationException;
import com.plant.hierarchy.exception.InvalidHierarchyInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Per-plant storage of SVG icons on the local filesystem.
 * Hierarchy nodes only keep the returned icon reference, never the SVG content.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IconStorageService {

    private static final String SVG_EXTENSION = ".svg";
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final Pattern SAFE_TENANT_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final HierarchyProperties properties;

    /**
     * Validate and store an uploaded SVG icon
     * @param iconName logical name; derived from the file name when blank
     */
    public IconInfo upload(String tenantId, String originalFilename, byte[] content, String iconName) {
        validateSvg(originalFilename, content);

        String name = safeName(iconName != null && !iconName.isBlank()
                ? iconName.trim()
                : stripExtension(Paths.get(originalFilename).getFileName().toString()));
        String filename = name + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8) + SVG_EXTENSION;

        Path dir = tenantDir(tenantId);
        Path destination = dir.resolve(filename);
        try {
            Files.createDirectories(dir);
            Files.write(destination, content);
        } catch (IOException e) {
            throw new IconStorageException("Failed to store icon " + filename, e);
        }

        log.info("Uploaded SVG icon for plant {}: {} -> {}", tenantId, name, filename);
        return toInfo(name, destination, content);
    }

    /**
     * All icons of the plant, ordered by file name
     */
    public List<IconInfo> listIcons(String tenantId) {
        Path dir = tenantDir(tenantId);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }

        List<IconInfo> icons = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(this::isSvgFile).sorted().toList()) {
                byte[] content = Files.readAllBytes(file);
                icons.add(toInfo(iconNameOf(file.getFileName().toString()), file, content));
            }
        } catch (IOException e) {
            throw new IconStorageException("Failed to list icons for plant " + tenantId, e);
        }
        return icons;
    }

    /**
     * Raw SVG content of one stored icon
     */
    public String readIcon(String tenantId, String filename) {
        Path dir = tenantDir(tenantId);
        Path file = dir.resolve(filename).normalize();
        if (!file.startsWith(dir) || !isSvgFile(file) || !Files.isRegularFile(file)) {
            throw new IconNotFoundException(tenantId, filename);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IconStorageException("Failed to read icon " + filename, e);
        }
    }

    /**
     * Turn an icon name into the reference of the newest stored icon with that name.
     * Values that already look like a reference (absolute path or URL) are returned as given,
     * as are names with no stored icon.
     */
    public String resolveIconRef(String tenantId, String iconNameOrRef) {
        if (iconNameOrRef == null || iconNameOrRef.startsWith("/") || iconNameOrRef.startsWith("http")) {
            return iconNameOrRef;
        }

        Path dir = tenantDir(tenantId);
        if (!Files.isDirectory(dir)) {
            return iconNameOrRef;
        }

        String storedName = safeName(iconNameOrRef);
        try (Stream<Path> files = Files.list(dir)) {
            Optional<Path> match = files
                    .filter(this::isSvgFile)
                    .filter(file -> iconNameOf(file.getFileName().toString()).equals(storedName))
                    .max(Comparator.comparingLong(this::lastModified));
            if (match.isEmpty()) {
                log.warn("No stored icon named '{}' for plant {}, keeping the name as reference", iconNameOrRef, tenantId);
            }
            return match.map(file -> file.toAbsolutePath().toString()).orElse(iconNameOrRef);
        } catch (IOException e) {
            throw new IconStorageException("Failed to look up icon " + iconNameOrRef, e);
        }
    }

    /**
     * Content of the stored icon an icon reference points to. Empty when the reference is not
     * an absolute path into the icon store, or the file is gone or unreadable.
     */
    public Optional<byte[]> readIconContent(String iconRef) {
        if (iconRef == null || !iconRef.startsWith("/")) {
            return Optional.empty();
        }

        Path base = Paths.get(properties.getIcons().getBaseDir()).toAbsolutePath().normalize();
        Path file = Paths.get(iconRef).normalize();
        if (!file.startsWith(base) || !isSvgFile(file) || !Files.isRegularFile(file)) {
            log.debug("Icon reference {} does not point to a stored icon", iconRef);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            log.warn("Error reading icon file {}: {}", iconRef, e.getMessage());
            return Optional.empty();
        }
    }

    void validateSvg(String originalFilename, byte[] content) {
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(SVG_EXTENSION)) {
            throw new IconValidationException("File must be an SVG file (.svg)");
        }
        if (content == null || content.length == 0) {
            throw new IconValidationException("SVG file is empty");
        }
        long maxSize = properties.getIcons().getMaxSizeBytes();
        if (content.length > maxSize) {
            throw new IconValidationException(String.format("SVG file too large (max %d bytes)", maxSize));
        }

        Document document;
        try {
            document = newDocumentBuilder().parse(new ByteArrayInputStream(content));
        } catch (SAXException | IOException e) {
            throw new IconValidationException("Invalid XML/SVG format: " + e.getMessage(), e);
        }

        String root = document.getDocumentElement().getLocalName() != null
                ? document.getDocumentElement().getLocalName()
                : document.getDocumentElement().getTagName();
        if (!"svg".equalsIgnoreCase(root)) {
            throw new IconValidationException("File does not contain valid SVG content");
        }
    }

    static String iconNameOf(String filename) {
        String name = stripExtension(filename);
        int lastUnderscore = name.lastIndexOf('_');
        return lastUnderscore > 0 ? name.substring(0, lastUnderscore) : name;
    }

    private DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            // fatal errors are thrown, nothing is printed
            builder.setErrorHandler(new DefaultHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser not available", e);
        }
    }

    private Path tenantDir(String tenantId) {
        if (tenantId == null || !SAFE_TENANT_ID.matcher(tenantId).matches()) {
            throw new InvalidHierarchyInputException(
                    "Plant id may only contain letters, digits, '_' and '-' to store icons: " + tenantId);
        }
        return Paths.get(properties.getIcons().getBaseDir(), "plant_" + tenantId)
                .toAbsolutePath()
                .normalize();
    }

    private IconInfo toInfo(String iconName, Path file, byte[] content) {
        return IconInfo.builder()
                .iconName(iconName)
                .filename(file.getFileName().toString())
                .iconRef(file.toAbsolutePath().toString())
                .sizeBytes(content.length)
                .svgBase64(Base64.getEncoder().encodeToString(content))
                .build();
    }

    private boolean isSvgFile(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(SVG_EXTENSION);
    }

    private long lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            throw new IconStorageException("Failed to read icon metadata " + file.getFileName(), e);
        }
    }

    private static String stripExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private static String safeName(String value) {
        String cleaned = UNSAFE_NAME_CHARS.matcher(value).replaceAll("_");
        return cleaned.isEmpty() ? "icon" : cleaned;
    }
}
