package projectpsi.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura de informes JSON.
 * <p>
 * Los {@code OptionalDouble} vacíos se escriben como {@code null} (módulo jdk8) y los
 * instantes en ISO-8601 (módulo jsr310).
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una única instancia.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a JSON. Crea el directorio padre si hace falta y sobrescribe el fichero.
     *
     * @throws IOException si falla la escritura.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando {} a {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * @throws IOException si el fichero no existe o su contenido no encaja con el tipo.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando {} como {}", path.toAbsolutePath(), objectType.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
