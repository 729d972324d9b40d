package com.example.smartcart;

import com.example.smartcart.services.OrderParser;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

public class OrderParserTests {
    private final OrderParser parser = new OrderParser();

    @Test
    void json_orders_repeat_items_by_quantity() {
        String raw = "{\"orders\": [{\"item_details\": [{\"item_name\": \"Wings\", \"item_quantity\": 2},"
                + " {\"item_name\": \"Fries\", \"item_quantity\": 1}]}]}";
        assertEquals(List.of("Wings", "Wings", "Fries"), parser.parse(raw));
    }

    @Test
    void quantity_repeat_is_capped() {
        String raw = "[{\"item_name\": \"Ranch Dip\", \"item_quantity\": 50}]";
        assertEquals(10, parser.parse(raw).size());
    }

    @Test
    void python_style_dict_text_is_accepted() {
        String raw = "{'orders': [{'item_details': [{'item_name': 'Chicken Sandwich', 'item_quantity': 1},"
                + " {'item_name': 'Bag', 'item_quantity': None}]}]}";
        assertEquals(List.of("Chicken Sandwich", "Bag"), parser.parse(raw));
    }

    @Test
    void delimited_text_is_split() {
        assertEquals(List.of("Wings", "Fries", "Ranch"), parser.parse("Wings | Fries;Ranch"));
        assertEquals(List.of("Wings", "Fries"), parser.parse("Wings\nFries"));
    }

    @Test
    void truncated_json_keeps_readable_names_only() {
        String raw = "{\"orders\": [{\"item_name\": \"Wings\", \"item_quantity\": 1}, {\"item_na";
        assertEquals(List.of("Wings"), parser.parse(raw));
        assertTrue(parser.parse("{\"orders\": [").isEmpty());
    }

    @Test
    void bracketed_list_of_bare_names_is_split() {
        assertEquals(List.of("Wings", "Fries", "Ranch"), parser.parse("[Wings, Fries, Ranch]"));
        assertEquals(List.of("Wings", "Fries"), parser.parse("{Wings|Fries}"));
    }

    @Test
    void missing_and_placeholder_cells_are_empty() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
        assertTrue(parser.parse("nan").isEmpty());
        assertTrue(parser.parse("None").isEmpty());
        assertTrue(parser.parse("[]").isEmpty());
    }

    @Test
    void clean_strips_quantities_quotes_and_punctuation() {
        assertEquals("Regular Fries", parser.clean("2x Regular Fries"));
        assertEquals("Regular Fries", parser.clean("Regular Fries x2"));
        assertEquals("Fries", parser.clean("Fries (2)"));
        assertEquals("Ranch Dip", parser.clean("\"Ranch Dip\","));
        assertEquals("Chicken Sandwich", parser.clean("  Chicken   Sandwich "));
        assertEquals("", parser.clean("n/a"));
    }

    @Test
    void clean_keeps_balanced_brackets_in_names() {
        assertEquals("Mac & Cheese (Large)", parser.clean("Mac & Cheese (Large)"));
        assertEquals("Wings", parser.clean("[Wings"));
    }

    @Test
    void cleanAll_drops_names_that_end_up_empty() {
        assertEquals(List.of("Wings"), parser.cleanAll(List.of("Wings", "", "  ", "null")));
    }
}
