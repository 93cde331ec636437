package com.ospicorp.pricelogger.interval;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.Collection;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes collections of records as CSV with a header row. The column order follows the element
 * type's {@code @JsonPropertyOrder}. An empty collection writes the header for {@link IntervalView}.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> collection,
      @NonNull HttpOutputMessage outputMessage) throws IOException, HttpMessageNotWritableException {
    CsvSchema schema = mapper.schemaFor(elementType(collection)).withHeader();
    try (SequenceWriter writer = mapper.writer(schema).writeValues(outputMessage.getBody())) {
      for (Object element : collection) {
        writer.write(element);
      }
    }
  }

  private static Class<?> elementType(Collection<?> collection) {
    for (Object element : collection) {
      if (element != null) {
        return element.getClass();
      }
    }
    return IntervalView.class;
  }
}
