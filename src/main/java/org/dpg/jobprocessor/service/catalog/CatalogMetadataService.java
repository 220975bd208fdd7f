package org.dpg.jobprocessor.service.catalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.common.apiclient.catalog.CatalogApiClient;
import org.dpg.jobprocessor.exception.apiclient.ApiException;
import org.dpg.jobprocessor.model.Metadata;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the few MARC fields finalization needs from the catalog record of a metadata item. A record
 * that cannot be fetched or parsed yields "unknown" rather than an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogMetadataService {

    private final CatalogApiClient catalogApiClient;

    /**
     * Publication year from 260$c.
     *
     * @return the year, or 0 if it is unknown.
     */
    public int publicationYear(final Metadata metadata) {
        log.info("Get publication date from MARC for pid [{}] barcode [{}]", metadata.getPid(), metadata.getBarcode());
        return loadDataFields(metadata).stream()
                                       .filter(df -> "260".equals(df.getAttribute("tag")))
                                       .flatMap(df -> subfields(df, "c").stream())
                                       .map(MarcYearParser::parseYear)
                                       .filter(year -> year > 0)
                                       .findFirst()
                                       .orElse(0);
    }

    /**
     * Shelf location of the item's barcode. MARC 999 repeats once per barcode: $i holds the barcode and
     * $l the location.
     *
     * @return the location, or an empty string if it is unknown.
     */
    public String location(final Metadata metadata) {
        for (final Element df : loadDataFields(metadata)) {
            if (!"999".equals(df.getAttribute("tag"))) {
                continue;
            }
            boolean barcodeMatch = false;
            final NodeList subfields = df.getElementsByTagNameNS("*", "subfield");
            for (int i = 0; i < subfields.getLength(); i++) {
                final Element sf = (Element) subfields.item(i);
                final String code = sf.getAttribute("code");
                if ("i".equals(code) && Objects.equals(sf.getTextContent(), metadata.getBarcode())) {
                    barcodeMatch = true;
                }
                if ("l".equals(code) && barcodeMatch) {
                    return sf.getTextContent();
                }
            }
        }
        return "";
    }

    private List<Element> loadDataFields(final Metadata metadata) {
        final Optional<Document> marc = fetch(metadata.getPid());
        if (marc.isEmpty()) {
            return List.of();
        }
        final NodeList nodes = marc.get().getElementsByTagNameNS("*", "datafield");
        final List<Element> dataFields = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            dataFields.add((Element) nodes.item(i));
        }
        return dataFields;
    }

    private static List<String> subfields(final Element dataField, final String code) {
        final NodeList nodes = dataField.getElementsByTagNameNS("*", "subfield");
        final List<String> values = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            final Element sf = (Element) nodes.item(i);
            if (code.equals(sf.getAttribute("code"))) {
                values.add(sf.getTextContent());
            }
        }
        return values;
    }

    private Optional<Document> fetch(final String pid) {
        try {
            final byte[] xml = catalogApiClient.fetchMarcXml(pid);
            return Optional.of(parse(xml));
        } catch (ApiException e) {
            log.error("Get MARC metadata for {} failed: {}:{}", pid, e.getStatusCode(), e.getMessage());
        } catch (ParserConfigurationException | SAXException | IOException e) {
            log.error("Unable to parse MARC metadata for {}", pid, e);
        }
        return Optional.empty();
    }

    static Document parse(final byte[] xml) throws ParserConfigurationException, SAXException, IOException {
        final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        final DocumentBuilder builder = factory.newDocumentBuilder();
        return builder.parse(new ByteArrayInputStream(xml));
    }
}
