package vn.com.fecredit.flowable.layout.util;

import org.flowable.bpmn.converter.BpmnXMLConverter;
import org.flowable.bpmn.model.BpmnModel;
import vn.com.fecredit.flowable.layout.exception.BpmnConversionException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

/**
 * Thin wrappers around Flowable's {@link BpmnXMLConverter} for both directions.
 */
public final class ModelConverterHelpers {
    private ModelConverterHelpers() {}

    public static byte[] toXmlBytes(BpmnModel model) {
        try {
            return new BpmnXMLConverter().convertToXML(model);
        } catch (RuntimeException e) {
            throw new BpmnConversionException("BPMN export failed: " + e.getMessage(), e);
        }
    }

    public static String toXml(BpmnModel model) {
        return new String(toXmlBytes(model), StandardCharsets.UTF_8);
    }

    /** Parses BPMN XML back into a model; used for round-trip checks and PNG rendering. */
    public static BpmnModel parse(byte[] xmlBytes) {
        if (xmlBytes == null || xmlBytes.length == 0) {
            throw new BpmnConversionException("BPMN document is empty");
        }
        XMLStreamReader xtr = null;
        try {
            XMLInputFactory xif = XMLInputFactory.newInstance();
            xif.setProperty(XMLInputFactory.SUPPORT_DTD, false);
            xtr = xif.createXMLStreamReader(new ByteArrayInputStream(xmlBytes));
            return new BpmnXMLConverter().convertToBpmnModel(xtr);
        } catch (XMLStreamException | RuntimeException e) {
            throw new BpmnConversionException("BPMN parse failed: " + e.getMessage(), e);
        } finally {
            if (xtr != null) {
                try {
                    xtr.close();
                } catch (XMLStreamException ignore) {
                    // reader already consumed
                }
            }
        }
    }
}
