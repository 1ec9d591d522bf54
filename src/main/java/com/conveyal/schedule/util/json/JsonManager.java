package com.conveyal.schedule.util.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;

/**
 * Helper methods for reading and writing one type of object as JSON.
 */
public class JsonManager<T> {
    private final ObjectWriter prettyWriter;
    private final ObjectMapper om;
    private final Class<T> theClass;

    /**
     * Create a new JsonManager
     * @param theClass The class to create a json manager for (yes, also in the diamonds).
     */
    public JsonManager (Class<T> theClass) {
        this.theClass = theClass;
        this.om = new ObjectMapper();
        om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.prettyWriter = om.writerWithDefaultPrettyPrinter();
    }

    public String writePretty(Object o) throws JsonProcessingException {
        return prettyWriter.writeValueAsString(o);
    }

    public T read (String s) throws IOException {
        return om.readValue(s, theClass);
    }
}
