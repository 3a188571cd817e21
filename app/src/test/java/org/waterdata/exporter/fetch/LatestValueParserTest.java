/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.waterdata.exporter.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.waterdata.exporter.model.FailureKind;
import org.waterdata.exporter.model.FetchOutcome;

import static org.junit.jupiter.api.Assertions.*;

class LatestValueParserTest {

    private final LatestValueParser parser = new LatestValueParser(new ObjectMapper());

    private static String feature(String valueJson) {
        return """
                {"type":"FeatureCollection","features":[
                  {"type":"Feature","id":"abc","properties":{"value":%s,"time":"2025-06-01T12:00:00+00:00"}}
                ],"numberReturned":1}
                """.formatted(valueJson);
    }

    private static void assertFailure(FailureKind expected, FetchOutcome outcome) {
        assertFalse(outcome.isSuccess(), "Expected failure but got " + outcome);
        assertEquals(expected, outcome.failureKind());
        assertNotNull(outcome.detail());
    }

    @Test
    void testParse_StringValue() {
        FetchOutcome outcome = parser.parse(feature("\"12.4\""));

        assertTrue(outcome.isSuccess());
        assertEquals(12.4, outcome.value());
    }

    @Test
    void testParse_NumericValue() {
        assertEquals(1530.0, parser.parse(feature("1530")).value());
    }

    @Test
    void testParse_NestedValueObject() {
        assertEquals(7.25, parser.parse(feature("{\"value\":\"7.25\",\"unit\":\"ft^3/s\"}")).value());
    }

    @Test
    void testParse_ValueWithWhitespace() {
        assertEquals(0.5, parser.parse(feature("\" 0.5 \"")).value());
    }

    @Test
    void testParse_EmptyFeatures_NoData() {
        assertFailure(FailureKind.NO_DATA, parser.parse("{\"type\":\"FeatureCollection\",\"features\":[]}"));
    }

    @Test
    void testParse_MissingFeatures_NoData() {
        assertFailure(FailureKind.NO_DATA, parser.parse("{\"type\":\"FeatureCollection\"}"));
    }

    @Test
    void testParse_NullValue_NoData() {
        assertFailure(FailureKind.NO_DATA, parser.parse(feature("null")));
    }

    @Test
    void testParse_BlankValue_NoData() {
        assertFailure(FailureKind.NO_DATA, parser.parse(feature("\"\"")));
    }

    @Test
    void testParse_MissingProperties_NoData() {
        assertFailure(FailureKind.NO_DATA, parser.parse("{\"features\":[{\"type\":\"Feature\"}]}"));
    }

    @Test
    void testParse_NonNumericValue_ParseError() {
        assertFailure(FailureKind.PARSE_ERROR, parser.parse(feature("\"Ice\"")));
    }

    @Test
    void testParse_NonFiniteValue_ParseError() {
        assertFailure(FailureKind.PARSE_ERROR, parser.parse(feature("\"NaN\"")));
        assertFailure(FailureKind.PARSE_ERROR, parser.parse(feature("\"Infinity\"")));
    }

    @Test
    void testParse_BooleanValue_ParseError() {
        assertFailure(FailureKind.PARSE_ERROR, parser.parse(feature("true")));
    }

    @Test
    void testParse_InvalidJson_ParseError() {
        assertFailure(FailureKind.PARSE_ERROR, parser.parse("<html>Service Unavailable</html>"));
    }

    @Test
    void testParse_FeaturesNotArray_ParseError() {
        assertFailure(FailureKind.PARSE_ERROR, parser.parse("{\"features\":\"none\"}"));
    }

    @Test
    void testParse_FeatureNotObject_ParseError() {
        assertFailure(FailureKind.PARSE_ERROR, parser.parse("{\"features\":[5]}"));
    }

    @Test
    void testParse_PropertiesNotObject_ParseError() {
        assertFailure(FailureKind.PARSE_ERROR, parser.parse("{\"features\":[{\"properties\":\"x\"}]}"));
        assertFailure(FailureKind.PARSE_ERROR, parser.parse("{\"features\":[{\"properties\":[1]}]}"));
    }

    @Test
    void testParse_TopLevelArray_ParseError() {
        assertFailure(FailureKind.PARSE_ERROR, parser.parse("[1,2,3]"));
    }

    @Test
    void testParse_EmptyBody_ParseError() {
        assertFailure(FailureKind.PARSE_ERROR, parser.parse(""));
        assertFailure(FailureKind.PARSE_ERROR, parser.parse(null));
    }
}
