package org.processgraph.reasoning.snapshot;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads BPMN 2.0 XML into a Camunda {@link BpmnModelInstance} and validates it against the
 * BPMN schema before any graph is built from it.
 */
@Slf4j
public class BpmnModelLoader {

    /**
     * Reads and validates a BPMN file from disk.
     *
     * @throws IllegalArgumentException if the file cannot be read or is not valid BPMN
     */
    public static BpmnModelInstance load(File bpmnFile) {
        try {
            BpmnModelInstance modelInstance = Bpmn.readModelFromFile(bpmnFile);
            Bpmn.validateModel(modelInstance);
            log.debug("Loaded BPMN model from {}", bpmnFile);
            return modelInstance;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid BPMN file: " + bpmnFile, e);
        }
    }

    /**
     * Reads and validates a BPMN file from the classpath.
     *
     * @throws IllegalArgumentException if the resource is missing or is not valid BPMN
     */
    public static BpmnModelInstance loadFromClasspath(String classpathResource) {
        try (InputStream is = BpmnModelLoader.class.getClassLoader().getResourceAsStream(classpathResource)) {
            if (is == null) {
                throw new IllegalArgumentException(
                        "BPMN resource not found on classpath: " + classpathResource
                );
            }
            BpmnModelInstance modelInstance = Bpmn.readModelFromStream(is);
            Bpmn.validateModel(modelInstance);
            return modelInstance;
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read BPMN resource: " + classpathResource, e);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid BPMN resource: " + classpathResource, e);
        }
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(File bpmnFile) {
        try {
            load(bpmnFile);
            return true;
        } catch (IllegalArgumentException e) {
            log.debug("BPMN file {} is invalid: {}", bpmnFile, e.getMessage());
            return false;
        }
    }

    /**
     * Writes the (possibly updated) model back to disk.
     */
    public static void write(File bpmnFile, BpmnModelInstance modelInstance) {
        Bpmn.validateModel(modelInstance);
        Bpmn.writeModelToFile(bpmnFile, modelInstance);
        log.info("Wrote BPMN model to {}", bpmnFile);
    }
}
