package org.ontobind.utils;

import com.hp.hpl.jena.ontology.OntModel;
import com.hp.hpl.jena.ontology.OntModelSpec;
import com.hp.hpl.jena.rdf.model.ModelFactory;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFLanguages;
import org.ontobind.ontology.OntologyStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class OntologyLoader {
    private static final Logger logger = LoggerFactory.getLogger(OntologyLoader.class);

    public static final String CLASSPATH_PREFIX = "classpath:";

    private static final Pattern URL_PATTERN = Pattern.compile("[^:]{2,6}:.*");
    private static final Pattern COMPRESSION_SUFFIX = Pattern.compile("\\.(bz2|gz)$");

    private OntologyLoader() {
    }

    /**
     * Load an ontology in a Jena OntModel, supports classpath resources, local uncompressed files, bziped/gzipped
     * files and remote files over http.
     *
     * @param lang the RDF syntax, guessed from the file extension when {@code null}
     */
    public static OntModel loadModel(final String modelURL, final OntModelSpec modelSpec, final Lang lang) {
        final OntModel ontModel = ModelFactory.createOntologyModel(modelSpec);
        final Lang rdfLang = (lang == null) ? guessLang(modelURL) : lang;

        logger.info("Reading ontology model...");
        if (modelURL.startsWith(CLASSPATH_PREFIX)) {
            final String resource = modelURL.substring(CLASSPATH_PREFIX.length());
            logger.info("\tFrom classpath: {}", resource);
            try (InputStream inputStream = openClasspathResource(resource)) {
                RDFDataMgr.read(ontModel, decompress(modelURL, inputStream), rdfLang);
            } catch (final IOException e) {
                throw new OntologyStoreException("Could not read " + modelURL, e);
            }
        } else {
            final Matcher matcher = URL_PATTERN.matcher(modelURL);
            if (matcher.matches()) {
                logger.info("\tFrom URL: {}", modelURL);
                RDFDataMgr.read(ontModel, modelURL, rdfLang);
            } else {
                logger.info("\tFrom File: {}", modelURL);
                try (InputStream inputStream = new FileInputStream(modelURL)) {
                    RDFDataMgr.read(ontModel, decompress(modelURL, inputStream), rdfLang);
                } catch (final FileNotFoundException e) {
                    logger.error("Could not read {}", modelURL);
                    throw new OntologyStoreException("Ontology file not found: " + modelURL, e);
                } catch (final IOException e) {
                    throw new OntologyStoreException("Could not read " + modelURL, e);
                }
            }
        }
        return ontModel;
    }

    private static InputStream openClasspathResource(final String resource) throws FileNotFoundException {
        final String path = resource.startsWith("/") ? resource : ("/" + resource);
        final InputStream inputStream = OntologyLoader.class.getResourceAsStream(path);
        if (inputStream == null) {
            throw new FileNotFoundException("No classpath resource " + path);
        }
        return inputStream;
    }

    @SuppressWarnings("resource")
    private static InputStream decompress(final String modelURL, final InputStream inputStream) throws IOException {
        final InputStream modelStream;
        if (modelURL.endsWith(".bz2")) {
            modelStream = new BZip2CompressorInputStream(inputStream);
        } else if (modelURL.endsWith(".gz")) {
            modelStream = new GzipCompressorInputStream(inputStream);
        } else {
            modelStream = inputStream;
        }
        return modelStream;
    }

    static Lang guessLang(final String modelURL) {
        final String uncompressed = COMPRESSION_SUFFIX.matcher(modelURL).replaceAll("");
        return RDFLanguages.filenameToLang(uncompressed, Lang.RDFXML);
    }
}
