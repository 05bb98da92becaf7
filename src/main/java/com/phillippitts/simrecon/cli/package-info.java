/**
 * picocli command-line interface hosted by Spring Boot.
 */
package com.phillippitts.simrecon.cli;
