package com.codehive.MPBS.Services;

import com.codehive.MPBS.Config.ParkingProperties;
import com.codehive.MPBS.DTO.BillDocument;
import com.codehive.MPBS.Entities.ParkingBill;
import com.codehive.MPBS.Exceptions.BillGenerationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders a bill as a single A4 page PDF.
 */
@Slf4j
@Service
public class BillDocumentGenerator {

    static final String CHARGE_TEXT = "Rs. 1000.00";

    private static final DateTimeFormatter BILL_DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy HH:mm");

    private static final List<String> TERMS = List.of(
            "1. This bill is valid only for the specified month.",
            "2. Vehicle should not block other slots.",
            "3. Parking charges are non-refundable.",
            "4. Management is not responsible for any damage/theft.",
            "5. Renewal should be done before 5th of every month.");

    private static final String RULE = "-".repeat(50);

    private static final PDFont REGULAR = PDType1Font.HELVETICA;
    private static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;
    private static final PDFont ITALIC = PDType1Font.HELVETICA_OBLIQUE;

    @Autowired
    private ParkingProperties parkingProperties;

    public BillDocument render(ParkingBill bill) {
        try (PDDocument document = new PDDocument();
                ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);

            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                writeBill(new PageCursor(content, page.getMediaBox()), bill);
            }

            document.save(out);
            return new BillDocument(fileName(bill), out.toByteArray());
        } catch (IOException | IllegalArgumentException e) {
            // IllegalArgumentException: text with glyphs the standard fonts cannot encode
            log.error("Rendering bill {} failed", bill.getId(), e);
            throw new BillGenerationException(e.getMessage(), e);
        }
    }

    public static String billNumber(Long id) {
        return String.format("PB%06d", id);
    }

    public static String fileName(ParkingBill bill) {
        return "Parking_Bill_" + bill.getCustomerName().replace(' ', '_') + "_" + bill.getMonth() + "_"
                + bill.getYear() + "_" + bill.getId() + ".pdf";
    }

    private void writeBill(PageCursor cursor, ParkingBill bill) throws IOException {
        ParkingProperties.Facility facility = parkingProperties.getFacility();

        // Header
        cursor.centered(facility.getName(), BOLD, 16);
        cursor.centered(facility.getContact(), REGULAR, 10);
        cursor.skip(18);

        cursor.centered("MONTHLY PARKING BILL", BOLD, 18);
        cursor.skip(6);
        cursor.centered("BILL ID: " + billNumber(bill.getId()), BOLD, 12);
        cursor.skip(8);

        // Details
        cursor.left("BILL DETAILS", BOLD, 12);
        cursor.row("Bill Date:", BILL_DATE_FORMAT.format(bill.getBillDate()), 11);
        cursor.row("Customer Name:", bill.getCustomerName(), 11);
        cursor.row("Vehicle Number:", bill.getVehicleNumber(), 11);
        cursor.row("Vehicle Type:", bill.getVehicleType().toUpperCase(Locale.ROOT), 11);
        cursor.row("Parking Slot:", bill.getSlotNumber(), 11);
        cursor.row("Parking Period:", bill.getMonth() + " " + bill.getYear(), 11);
        cursor.row("Payment Mode:", bill.getPaymentMode(), 11);
        cursor.row("Generated By:", bill.getGeneratedBy(), 11);
        cursor.row("Status:", "PAID", 11);
        cursor.skip(14);

        // Amount
        cursor.left("AMOUNT DETAILS", BOLD, 12);
        cursor.amount("Monthly Parking Charges:", CHARGE_TEXT, REGULAR, 11);
        cursor.skip(8);
        cursor.amount("TOTAL AMOUNT:", CHARGE_TEXT, BOLD, 14);
        cursor.skip(16);

        cursor.left("TERMS & CONDITIONS:", BOLD, 10);
        for (String term : TERMS) {
            cursor.left(term, REGULAR, 8);
        }
        cursor.skip(14);

        writeFooter(cursor);
    }

    private void writeFooter(PageCursor cursor) throws IOException {
        cursor.centered(RULE, BOLD, 8);
        cursor.centered("CODE HIVE", BOLD, 10);
        cursor.centered("LEARN AND LEAD", ITALIC, 8);
        cursor.centered(RULE, BOLD, 8);
        cursor.skip(2);

        cursor.centered("Development Partner", BOLD, 8);
        cursor.centered("Email: codehive143@gmail.com", REGULAR, 7);
        cursor.centered("Phone: +91 63745 76277", REGULAR, 7);
        cursor.centered("Web: www.codehive.dev", REGULAR, 7);
        cursor.skip(3);

        cursor.centered("Thank you for choosing Vengatesan Car Parking!", ITALIC, 7);
        cursor.centered("This is a computer-generated bill.", ITALIC, 7);
    }

    /**
     * Top-down text writer: each call prints one line and moves the baseline down.
     */
    private static final class PageCursor {
        private static final float MARGIN = 50f;
        private static final float VALUE_COLUMN = 170f;
        private static final float AMOUNT_COLUMN = 360f;
        private static final float LEADING = 1.45f;

        private final PDPageContentStream content;
        private final float pageWidth;
        private float y;

        PageCursor(PDPageContentStream content, PDRectangle mediaBox) {
            this.content = content;
            this.pageWidth = mediaBox.getWidth();
            this.y = mediaBox.getHeight() - MARGIN;
        }

        void centered(String text, PDFont font, float size) throws IOException {
            float width = font.getStringWidth(text) / 1000f * size;
            draw(text, font, size, (pageWidth - width) / 2f);
            newLine(size);
        }

        void left(String text, PDFont font, float size) throws IOException {
            draw(text, font, size, MARGIN);
            newLine(size);
        }

        void row(String label, String value, float size) throws IOException {
            draw(label, REGULAR, size, MARGIN);
            draw(value, REGULAR, size, VALUE_COLUMN);
            newLine(size);
        }

        void amount(String label, String value, PDFont font, float size) throws IOException {
            draw(label, font, size, MARGIN);
            draw(value, font, size, AMOUNT_COLUMN);
            newLine(size);
        }

        void skip(float points) {
            y -= points;
        }

        private void draw(String text, PDFont font, float size, float x) throws IOException {
            content.beginText();
            content.setFont(font, size);
            content.newLineAtOffset(x, y);
            content.showText(text == null ? "" : text);
            content.endText();
        }

        private void newLine(float size) {
            y -= size * LEADING;
        }
    }
}
